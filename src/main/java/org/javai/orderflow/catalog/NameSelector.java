package org.javai.orderflow.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves a customer's loose reference ("٢", "البرجر", "الدجاج") against a short list of named
 * things, such as the lines of an order or the items just offered.
 *
 * <p>Names are compared after {@link TextNormalizer#normalize}. The first rule that matches
 * anything wins:</p>
 * <ol>
 *   <li>containment of the whole selector in the name, or of the name in the selector</li>
 *   <li>any selector word longer than two characters contained in the name; a word with the
 *   definite article also tries its bare form</li>
 * </ol>
 */
public final class NameSelector {

	private NameSelector() {
	}

	/**
	 * Positions of every candidate the selector names, in list order. Empty when nothing matches.
	 */
	public static <T> List<Integer> matchAll(String selector, List<T> candidates, Function<T, String> name) {
		String wanted = TextNormalizer.normalize(selector);
		List<Integer> matches = new ArrayList<>();
		if (wanted.isEmpty()) {
			return matches;
		}
		for (int i = 0; i < candidates.size(); i++) {
			String candidate = TextNormalizer.normalize(name.apply(candidates.get(i)));
			if (candidate.contains(wanted) || wanted.contains(candidate)) {
				matches.add(i);
			}
		}
		if (!matches.isEmpty()) {
			return matches;
		}
		List<String> words = selectorWords(selector);
		for (int i = 0; i < candidates.size(); i++) {
			String candidate = TextNormalizer.normalize(name.apply(candidates.get(i)));
			if (words.stream().anyMatch(candidate::contains)) {
				matches.add(i);
			}
		}
		return matches;
	}

	/**
	 * Parses a 1-based position written with Latin or Arabic-Indic digits.
	 */
	public static Optional<Integer> position(String selector) {
		String trimmed = selector.trim();
		StringBuilder digits = new StringBuilder();
		for (int i = 0; i < trimmed.length(); i++) {
			char c = trimmed.charAt(i);
			if (c >= '٠' && c <= '٩') {
				digits.append((char) ('0' + (c - '٠')));
			}
			else if (c >= '0' && c <= '9') {
				digits.append(c);
			}
			else {
				return Optional.empty();
			}
		}
		if (digits.length() == 0 || digits.length() > 3) {
			return Optional.empty();
		}
		return Optional.of(Integer.parseInt(digits.toString()));
	}

	// "البرجر" should find "برجر لحم"
	private static List<String> selectorWords(String selector) {
		List<String> words = new ArrayList<>();
		for (String token : TextNormalizer.significantTokens(selector)) {
			words.add(token);
			if (token.startsWith("ال") && token.length() > 4) {
				words.add(token.substring(2));
			}
		}
		return words;
	}
}
