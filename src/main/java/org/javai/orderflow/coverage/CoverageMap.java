package org.javai.orderflow.coverage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.orderflow.catalog.TextNormalizer;

/**
 * Immutable lookup of the districts the restaurant delivers to.
 *
 * <p>Customers name districts loosely ("حي النرجس", "النرجس", "النرجص"), so matching is fuzzy.
 * After normalization and prefix stripping, the first rule that hits wins:</p>
 * <ol>
 *   <li>exact equality</li>
 *   <li>containment either way, when the shorter side is at least 80% of the longer</li>
 *   <li>Levenshtein distance of at most {@code max(1, length / 5)}</li>
 * </ol>
 */
public final class CoverageMap {

	private static final List<String> PREFIXES = List.of("حي ", "منطقه ", "شارع ");
	private static final double CONTAINMENT_RATIO = 0.8;

	private final List<CoverageZone> zones;
	private final List<String> normalizedNames;

	public CoverageMap(List<CoverageZone> zones) {
		Objects.requireNonNull(zones, "zones must not be null");
		this.zones = List.copyOf(zones);
		List<String> names = new ArrayList<>(this.zones.size());
		for (CoverageZone zone : this.zones) {
			names.add(normalizeDistrict(zone.district()));
		}
		this.normalizedNames = List.copyOf(names);
	}

	public List<CoverageZone> zones() {
		return zones;
	}

	/**
	 * Finds the zone a customer-supplied district name refers to.
	 */
	public Optional<CoverageZone> match(String district) {
		String wanted = normalizeDistrict(district);
		if (wanted.isEmpty()) {
			return Optional.empty();
		}
		for (int i = 0; i < zones.size(); i++) {
			if (normalizedNames.get(i).equals(wanted)) {
				return Optional.of(zones.get(i));
			}
		}
		for (int i = 0; i < zones.size(); i++) {
			String name = normalizedNames.get(i);
			if (name.contains(wanted) || wanted.contains(name)) {
				int shorter = Math.min(name.length(), wanted.length());
				int longer = Math.max(name.length(), wanted.length());
				if (shorter >= longer * CONTAINMENT_RATIO) {
					return Optional.of(zones.get(i));
				}
			}
		}
		CoverageZone best = null;
		int bestDistance = Integer.MAX_VALUE;
		for (int i = 0; i < zones.size(); i++) {
			String name = normalizedNames.get(i);
			int distance = levenshtein(wanted, name);
			int allowed = Math.max(1, Math.max(wanted.length(), name.length()) / 5);
			if (distance <= allowed && distance < bestDistance) {
				best = zones.get(i);
				bestDistance = distance;
			}
		}
		return Optional.ofNullable(best);
	}

	/**
	 * First {@code limit} covered districts, in data order.
	 */
	public List<String> suggestions(int limit) {
		return zones.stream().limit(Math.max(0, limit)).map(CoverageZone::district).toList();
	}

	static String normalizeDistrict(String district) {
		String normalized = TextNormalizer.normalize(district);
		boolean stripped = true;
		while (stripped) {
			stripped = false;
			for (String prefix : PREFIXES) {
				if (normalized.startsWith(prefix)) {
					normalized = normalized.substring(prefix.length()).trim();
					stripped = true;
				}
			}
		}
		return normalized;
	}

	static int levenshtein(String a, String b) {
		int[] previous = new int[b.length() + 1];
		int[] current = new int[b.length() + 1];
		for (int j = 0; j <= b.length(); j++) {
			previous[j] = j;
		}
		for (int i = 1; i <= a.length(); i++) {
			current[0] = i;
			for (int j = 1; j <= b.length(); j++) {
				int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
				current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
			}
			int[] swap = previous;
			previous = current;
			current = swap;
		}
		return previous[b.length()];
	}
}
