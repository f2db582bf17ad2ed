package org.javai.orderflow.session;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.catalog.CatalogIndex;
import org.javai.orderflow.catalog.CatalogItem;
import org.javai.orderflow.coverage.CoverageZone;
import org.javai.orderflow.ledger.LineItem;
import org.javai.orderflow.ledger.OrderLedger;

/**
 * The single mutable state container of one conversation.
 *
 * <p>All mutators check that the session is still {@link SessionStatus#ACTIVE} and fail with
 * {@link ErrorKind#SESSION_CLOSED} otherwise, so a confirmed or timed-out order cannot change.
 * The location flags keep {@code addressComplete ⇒ locationConfirmed}: every path that clears
 * the confirmation also clears the address flag.</p>
 *
 * <p>A record is not thread-safe. The {@link SessionStore} hands out a per-session lock and the
 * orchestrator holds it for the whole turn.</p>
 */
public class SessionRecord {

	public static final int MAX_OFFERED_ITEMS = 5;
	static final String UNSPECIFIED_ADDRESS = "غير محدد";

	private final String id;
	private final Instant createdAt;
	private Instant lastActivity;
	private SessionStatus status = SessionStatus.ACTIVE;
	private Stage activeStage;

	private String customerName;
	private String phoneNumber;

	private FulfilmentMode mode = FulfilmentMode.DELIVERY;
	private boolean modeSelected;

	private String district;
	private String street;
	private String building;
	private String addressNotes;
	private BigDecimal deliveryFee;
	private String estimatedTime;
	private boolean locationConfirmed;
	private boolean addressComplete;

	private final LinkedHashSet<String> constraints = new LinkedHashSet<>();
	private final OrderLedger ledger;
	private final ConversationBuffer buffer;
	private final List<PendingItem> pendingItems = new ArrayList<>();
	private final List<CatalogItem> offeredItems = new ArrayList<>();
	private PendingHandoff pendingHandoff;

	private String orderId;
	private Instant confirmedAt;

	public SessionRecord(String id, Instant createdAt, CatalogIndex catalog, int bufferCapacity) {
		this.id = Objects.requireNonNull(id, "id must not be null");
		this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
		this.lastActivity = createdAt;
		this.ledger = new OrderLedger(catalog);
		this.buffer = new ConversationBuffer(bufferCapacity);
	}

	// identity and lifecycle

	public String id() {
		return id;
	}

	public Instant createdAt() {
		return createdAt;
	}

	public Instant lastActivity() {
		return lastActivity;
	}

	public void touch(Instant now) {
		if (now.isAfter(lastActivity)) {
			lastActivity = now;
		}
	}

	public SessionStatus status() {
		return status;
	}

	public boolean isActive() {
		return status == SessionStatus.ACTIVE;
	}

	public Optional<Stage> activeStage() {
		return Optional.ofNullable(activeStage);
	}

	public void setActiveStage(Stage stage) {
		this.activeStage = Objects.requireNonNull(stage, "stage must not be null");
	}

	/**
	 * Closes the order after a successful confirmation.
	 */
	public void complete(String confirmedOrderId, Instant now) {
		ensureActive();
		this.orderId = Objects.requireNonNull(confirmedOrderId, "confirmedOrderId must not be null");
		this.confirmedAt = now;
		this.status = SessionStatus.COMPLETED;
		ledger.close();
	}

	public void markTimedOut() {
		if (status == SessionStatus.ACTIVE) {
			status = SessionStatus.TIMED_OUT;
			ledger.close();
		}
	}

	public Optional<String> orderId() {
		return Optional.ofNullable(orderId);
	}

	public Optional<Instant> confirmedAt() {
		return Optional.ofNullable(confirmedAt);
	}

	public void ensureActive() {
		if (status != SessionStatus.ACTIVE) {
			throw OrderingException.sessionClosed(id);
		}
	}

	// customer

	public Optional<String> customerName() {
		return Optional.ofNullable(customerName);
	}

	/**
	 * @return false if the same name was already recorded
	 */
	public boolean setCustomerName(String name) {
		ensureActive();
		String trimmed = requireText(name, "name");
		if (trimmed.equals(customerName)) {
			return false;
		}
		customerName = trimmed;
		return true;
	}

	public Optional<String> phoneNumber() {
		return Optional.ofNullable(phoneNumber);
	}

	/**
	 * Stores the phone number without spaces, dashes or underscores.
	 *
	 * @return false if the same number was already recorded
	 */
	public boolean setPhoneNumber(String phone) {
		ensureActive();
		String normalized = normalizePhone(phone);
		long digits = normalized.chars().filter(Character::isDigit).count();
		if (digits < 9) {
			throw new OrderingException(ErrorKind.INVALID_ARGUMENT,
					"Phone number '" + phone + "' is too short", Map.of("phone", normalized));
		}
		if (normalized.equals(phoneNumber)) {
			return false;
		}
		phoneNumber = normalized;
		return true;
	}

	static String normalizePhone(String phone) {
		return requireText(phone, "phone").replaceAll("[\\s\\-_]", "");
	}

	// fulfilment and location

	public FulfilmentMode mode() {
		return mode;
	}

	public boolean modeSelected() {
		return modeSelected;
	}

	/**
	 * Records the customer's choice. Switching to pickup drops the delivery fee, ETA and
	 * location confirmation; switching to delivery requires the district to be confirmed again.
	 *
	 * @return false if this mode was already selected
	 */
	public boolean selectMode(FulfilmentMode newMode) {
		ensureActive();
		Objects.requireNonNull(newMode, "newMode must not be null");
		if (modeSelected && mode == newMode) {
			return false;
		}
		boolean switching = mode != newMode;
		mode = newMode;
		modeSelected = true;
		if (switching) {
			clearLocationConfirmation();
		}
		return true;
	}

	public Optional<String> district() {
		return Optional.ofNullable(district);
	}

	public Optional<String> street() {
		return Optional.ofNullable(street);
	}

	public Optional<String> building() {
		return Optional.ofNullable(building);
	}

	public Optional<String> addressNotes() {
		return Optional.ofNullable(addressNotes);
	}

	public Optional<BigDecimal> deliveryFee() {
		return Optional.ofNullable(deliveryFee);
	}

	public Optional<String> estimatedTime() {
		return Optional.ofNullable(estimatedTime);
	}

	public boolean locationConfirmed() {
		return locationConfirmed;
	}

	public boolean addressComplete() {
		return addressComplete;
	}

	/**
	 * Applies a successful coverage check. Selecting a different district discards the street
	 * and building collected for the previous one.
	 */
	public void confirmLocation(CoverageZone zone) {
		ensureActive();
		Objects.requireNonNull(zone, "zone must not be null");
		if (district != null && !district.equals(zone.district())) {
			street = null;
			building = null;
			addressNotes = null;
		}
		district = zone.district();
		deliveryFee = zone.deliveryFee();
		estimatedTime = zone.estimatedTime();
		mode = FulfilmentMode.DELIVERY;
		modeSelected = true;
		locationConfirmed = true;
		addressComplete = street != null && building != null;
	}

	/**
	 * Merges address fields. Null or blank arguments keep the current value.
	 *
	 * @return the fields still missing ("street", "building"), empty once the address is complete
	 * @throws OrderingException DISTRICT_NOT_CONFIRMED if no district has been validated yet
	 */
	public List<String> updateAddress(String newStreet, String newBuilding, String newNotes) {
		ensureActive();
		if (!locationConfirmed) {
			throw new OrderingException(ErrorKind.DISTRICT_NOT_CONFIRMED,
					"The delivery district must be confirmed before the address");
		}
		if (newStreet != null && !newStreet.isBlank()) {
			street = newStreet.trim();
		}
		if (newBuilding != null && !newBuilding.isBlank()) {
			building = newBuilding.trim();
		}
		if (newNotes != null && !newNotes.isBlank()) {
			addressNotes = newNotes.trim();
		}
		List<String> missing = new ArrayList<>();
		if (street == null) {
			missing.add("street");
		}
		if (building == null) {
			missing.add("building");
		}
		addressComplete = missing.isEmpty();
		return List.copyOf(missing);
	}

	/**
	 * Display address: "حي X، street، مبنى N، (notes)".
	 */
	public String fullAddress() {
		List<String> parts = new ArrayList<>();
		if (district != null) {
			parts.add("حي " + district);
		}
		if (street != null) {
			parts.add(street);
		}
		if (building != null) {
			parts.add("مبنى " + building);
		}
		if (addressNotes != null) {
			parts.add("(" + addressNotes + ")");
		}
		return parts.isEmpty() ? UNSPECIFIED_ADDRESS : String.join("، ", parts);
	}

	private void clearLocationConfirmation() {
		locationConfirmed = false;
		addressComplete = false;
		deliveryFee = null;
		estimatedTime = null;
	}

	// constraints

	public List<String> constraints() {
		return List.copyOf(constraints);
	}

	/**
	 * @return true if the constraint was not present before
	 */
	public boolean addConstraint(String constraint) {
		ensureActive();
		return constraints.add(requireText(constraint, "constraint"));
	}

	// ledger

	/**
	 * The order lines. Changes go through {@link #addItem}, {@link #modifyItem} and
	 * {@link #removeItem}; the ledger itself refuses changes once the session is closed.
	 */
	public OrderLedger ledger() {
		return ledger;
	}

	public LineItem addItem(String catalogId, int quantity, String size, String notes) {
		ensureActive();
		LineItem line = ledger.add(catalogId, quantity, size, notes);
		pendingItems.clear();
		return line;
	}

	public LineItem modifyItem(String selector, Integer quantity, String size, String notes) {
		ensureActive();
		return ledger.modify(selector, quantity, size, notes);
	}

	public LineItem removeItem(String selector) {
		ensureActive();
		return ledger.remove(selector);
	}

	// buffers

	public ConversationBuffer buffer() {
		return buffer;
	}

	public List<PendingItem> pendingItems() {
		return List.copyOf(pendingItems);
	}

	/**
	 * @return false if an item with the same text is already pending
	 */
	public boolean addPendingItem(PendingItem item) {
		ensureActive();
		Objects.requireNonNull(item, "item must not be null");
		if (pendingItems.stream().anyMatch(existing -> existing.text().equals(item.text()))) {
			return false;
		}
		return pendingItems.add(item);
	}

	/**
	 * Returns and clears the pending items.
	 */
	public List<PendingItem> drainPendingItems() {
		List<PendingItem> drained = List.copyOf(pendingItems);
		pendingItems.clear();
		return drained;
	}

	public List<CatalogItem> offeredItems() {
		return List.copyOf(offeredItems);
	}

	public void setOfferedItems(List<CatalogItem> items) {
		offeredItems.clear();
		items.stream().limit(MAX_OFFERED_ITEMS).forEach(offeredItems::add);
	}

	public Optional<PendingHandoff> pendingHandoff() {
		return Optional.ofNullable(pendingHandoff);
	}

	public void setPendingHandoff(PendingHandoff handoff) {
		this.pendingHandoff = handoff;
	}

	/**
	 * Returns and clears the pending handoff.
	 */
	public Optional<PendingHandoff> consumePendingHandoff() {
		Optional<PendingHandoff> current = Optional.ofNullable(pendingHandoff);
		pendingHandoff = null;
		return current;
	}

	private static String requireText(String value, String field) {
		if (value == null || value.isBlank()) {
			throw new OrderingException(ErrorKind.INVALID_ARGUMENT, field + " must not be blank");
		}
		return value.trim();
	}
}
