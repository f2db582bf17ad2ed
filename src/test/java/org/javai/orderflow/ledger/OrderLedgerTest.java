package org.javai.orderflow.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.testsupport.TestFixtures;
import org.junit.jupiter.api.Test;

class OrderLedgerTest {

	private final OrderLedger ledger = new OrderLedger(TestFixtures.catalog());

	@Test
	void addUsesDefaultSizeForSizedItems() {
		LineItem line = ledger.add("burger_beef", 2, null, null);

		assertThat(line.size()).isEqualTo("وسط");
		assertThat(line.unitPrice()).isEqualByComparingTo("22");
		assertThat(ledger.total()).isEqualByComparingTo("44");
	}

	@Test
	void repeatedAddAppendsLine() {
		ledger.add("pepsi", 2, null, null);
		LineItem second = ledger.add("pepsi", 3, null, null);

		assertThat(second.quantity()).isEqualTo(3);
		assertThat(ledger.lines()).extracting(LineItem::quantity).containsExactly(2, 3);
		assertThat(ledger.total()).isEqualByComparingTo("25");
	}

	@Test
	void addThenRemoveRestoresPriorTotal() {
		ledger.add("burger_beef", 1, "كبير", null);
		ledger.add("pepsi", 2, null, null);
		BigDecimal before = ledger.total();

		ledger.add("pepsi", 1, null, null);
		LineItem removed = ledger.remove("بيبسي");

		assertThat(removed.quantity()).isEqualTo(1);
		assertThat(ledger.total()).isEqualByComparingTo(before);
		assertThat(ledger.lines()).extracting(LineItem::quantity).containsExactly(1, 2);
	}

	@Test
	void addsBeyondTenAcrossLinesAreAllowed() {
		ledger.add("pepsi", 8, null, null);
		ledger.add("pepsi", 3, null, null);

		assertThat(ledger.size()).isEqualTo(2);
		assertThat(ledger.total()).isEqualByComparingTo("55");
	}

	@Test
	void differentNotesKeepSeparateLines() {
		ledger.add("shawarma_chicken", 1, null, null);
		ledger.add("shawarma_chicken", 1, null, "بدون ثوم");

		assertThat(ledger.lines()).extracting(LineItem::notes).containsExactly(null, "بدون ثوم");
	}

	@Test
	void quantityOutOfRangeIsRejected() {
		assertThatThrownBy(() -> ledger.add("pepsi", 0, null, null))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_QUANTITY));
		assertThatThrownBy(() -> ledger.add("pepsi", 11, null, null))
				.isInstanceOf(OrderingException.class);
		assertThat(ledger.isEmpty()).isTrue();
	}

	@Test
	void unavailableItemIsRejected() {
		assertThatThrownBy(() -> ledger.add("mandi_meat", 1, null, null))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.ITEM_UNAVAILABLE));
	}

	@Test
	void unknownSizeListsAvailableSizes() {
		assertThatThrownBy(() -> ledger.add("burger_beef", 1, "عائلي", null))
				.isInstanceOfSatisfying(OrderingException.class, e -> {
					assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_SIZE);
					assertThat(e.details()).containsKey("availableSizes");
				});
	}

	@Test
	void sizeOnUnsizedItemIsRejected() {
		assertThatThrownBy(() -> ledger.add("hummus", 1, "كبير", null))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_SIZE));
	}

	@Test
	void unknownCatalogIdIsNotFound() {
		assertThatThrownBy(() -> ledger.add("pizza", 1, null, null))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.ITEM_NOT_FOUND));
	}

	@Test
	void modifyBySizeRepricesLine() {
		ledger.add("burger_beef", 1, null, null);

		LineItem updated = ledger.modify("1", null, "كبير", null);

		assertThat(updated.unitPrice()).isEqualByComparingTo("27");
		assertThat(ledger.total()).isEqualByComparingTo("27");
	}

	@Test
	void modifyByArabicIndicPosition() {
		ledger.add("pepsi", 1, null, null);
		ledger.add("fries", 1, null, null);

		ledger.modify("٢", 4, null, null);

		assertThat(ledger.lines().get(1).quantity()).isEqualTo(4);
	}

	@Test
	void modifyWithNothingToChangeIsInvalid() {
		ledger.add("pepsi", 1, null, null);

		assertThatThrownBy(() -> ledger.modify("1", null, " ", null))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT));
	}

	@Test
	void removeByDefiniteArticleName() {
		ledger.add("burger_beef", 1, null, null);
		ledger.add("pepsi", 2, null, null);

		LineItem removed = ledger.remove("البرجر");

		assertThat(removed.catalogId()).isEqualTo("burger_beef");
		assertThat(ledger.lines()).extracting(LineItem::catalogId).containsExactly("pepsi");
	}

	@Test
	void ambiguousSelectorIsNotFound() {
		ledger.add("burger_beef", 1, null, null);
		ledger.add("burger_chicken", 1, null, null);

		assertThatThrownBy(() -> ledger.remove("برجر"))
				.isInstanceOfSatisfying(OrderingException.class, e -> {
					assertThat(e.kind()).isEqualTo(ErrorKind.ITEM_NOT_FOUND);
					assertThat(e.getMessage()).contains("matches 2 items");
				});
		assertThat(ledger.size()).isEqualTo(2);
	}

	@Test
	void sameItemWithDifferentSizesStaysAmbiguous() {
		ledger.add("burger_beef", 1, "كبير", null);
		ledger.add("burger_beef", 1, "وسط", null);

		assertThatThrownBy(() -> ledger.remove("برجر لحم"))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.ITEM_NOT_FOUND));
	}

	@Test
	void closedLedgerRefusesChangesButStillReads() {
		ledger.add("pepsi", 1, null, null);
		ledger.close();

		assertThatThrownBy(() -> ledger.add("pepsi", 1, null, null))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.SESSION_CLOSED));
		assertThatThrownBy(() -> ledger.modify("1", 2, null, null))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.SESSION_CLOSED));
		assertThatThrownBy(() -> ledger.remove("1"))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.SESSION_CLOSED));
		assertThat(ledger.isClosed()).isTrue();
		assertThat(ledger.total()).isEqualByComparingTo("5");
	}

	@Test
	void positionOutOfRangeIsNotFound() {
		ledger.add("pepsi", 1, null, null);

		assertThatThrownBy(() -> ledger.remove("3"))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.ITEM_NOT_FOUND));
	}

	@Test
	void selectorOnEmptyOrderReportsEmptyOrder() {
		assertThatThrownBy(() -> ledger.remove("1"))
				.isInstanceOfSatisfying(OrderingException.class,
						e -> assertThat(e.kind()).isEqualTo(ErrorKind.EMPTY_ORDER));
	}

	@Test
	void summaryListsNumberedLinesAndSubtotal() {
		assertThat(ledger.summary()).isEqualTo("order: empty");

		ledger.add("burger_beef", 2, "كبير", null);
		ledger.add("pepsi", 1, null, null);

		assertThat(ledger.summary()).isEqualTo("1. 2 x برجر لحم كبير = 54\n2. 1 x بيبسي = 5\nsubtotal: 59");
	}
}
