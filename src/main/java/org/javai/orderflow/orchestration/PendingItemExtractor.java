package org.javai.orderflow.orchestration;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.orderflow.session.PendingItem;

/**
 * Captures an order phrase said before the ordering stage ("أبي اثنين كبسة لحم توصيل") so it
 * can be handed to the ordering stage.
 */
public class PendingItemExtractor {

	private static final Pattern ORDER_PHRASE = Pattern.compile(
			"(?:أبي|ابي|أبغى|ابغى|ابغي|حاب|عايز|بدي|أريد|اريد)\\s+(?:اطلب\\s+|أطلب\\s+)?(.+)");

	private static final Pattern MODE_WORDS = Pattern.compile(
			"\\s*(?:مع\\s+|و)?(?:توصيل|استلام|سفري|من الفرع)\\s*");

	private static final Pattern LEADING_QUANTITY = Pattern.compile("^(\\d{1,2}|[٠-٩]{1,2}|\\S+)\\s+(.+)$");

	private static final Map<String, Integer> QUANTITY_WORDS = Map.ofEntries(
			Map.entry("واحد", 1),
			Map.entry("وحده", 1),
			Map.entry("وحدة", 1),
			Map.entry("اثنين", 2),
			Map.entry("ثنين", 2),
			Map.entry("اثنان", 2),
			Map.entry("ثلاث", 3),
			Map.entry("ثلاثة", 3),
			Map.entry("ثلاثه", 3),
			Map.entry("اربع", 4),
			Map.entry("أربع", 4),
			Map.entry("اربعة", 4),
			Map.entry("أربعة", 4),
			Map.entry("خمس", 5),
			Map.entry("خمسة", 5));

	public Optional<PendingItem> extract(String text) {
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		Matcher matcher = ORDER_PHRASE.matcher(text.strip());
		if (!matcher.find()) {
			return Optional.empty();
		}
		String phrase = MODE_WORDS.matcher(matcher.group(1)).replaceAll(" ").strip();
		phrase = phrase.replaceAll("[.!؟?،,]+$", "").strip();
		if (phrase.isEmpty()) {
			return Optional.empty();
		}

		int quantity = 1;
		Matcher leading = LEADING_QUANTITY.matcher(phrase);
		if (leading.matches()) {
			Integer parsed = quantity(leading.group(1));
			if (parsed != null) {
				quantity = parsed;
				phrase = leading.group(2).strip();
			}
		}
		if (phrase.length() < 2) {
			return Optional.empty();
		}
		return Optional.of(new PendingItem(phrase, quantity));
	}

	private static Integer quantity(String token) {
		Integer word = QUANTITY_WORDS.get(token);
		if (word != null) {
			return word;
		}
		StringBuilder digits = new StringBuilder();
		for (char c : token.toCharArray()) {
			if (c >= '0' && c <= '9') {
				digits.append(c);
			}
			else if (c >= '٠' && c <= '٩') {
				digits.append((char) ('0' + (c - '٠')));
			}
			else {
				return null;
			}
		}
		int value = Integer.parseInt(digits.toString());
		return value >= 1 ? value : null;
	}
}
