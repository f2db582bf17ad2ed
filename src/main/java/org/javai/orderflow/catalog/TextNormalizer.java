package org.javai.orderflow.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Orthographic normalization for Arabic menu text.
 *
 * <p>Customers type the same dish in many ways: with or without diacritics, with any of the
 * alef variants, or with a dialect spelling ("برقر" for "برجر"). Every comparison in the catalog,
 * the ledger selector and the coverage map runs on the normalized form so those variants
 * compare equal.</p>
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>strip tashkeel and tatweel</li>
 *   <li>unify alef variants (أ إ آ ٱ → ا) and hamza carriers (ؤ → و, ئ → ي)</li>
 *   <li>teh marbuta → heh, alef maqsura → yeh</li>
 *   <li>apply whole-word food spelling fixes</li>
 *   <li>collapse whitespace and lower-case</li>
 * </ol>
 *
 * <p>{@link #phonetic(String)} additionally folds letters that dialects pronounce alike
 * (ق ك → ج, س ذ → ز). It is lossy and only used as a secondary equality check.</p>
 */
public final class TextNormalizer {

	private static final Pattern TASHKEEL = Pattern.compile("[\\u064B-\\u065F\\u0670\\u0640]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private static final Map<String, List<String>> FOOD_SPELLING_FIXES = new LinkedHashMap<>();

	static {
		FOOD_SPELLING_FIXES.put("برجر", List.of("برقر", "بركر", "برغر", "بيرجر", "بورجر"));
		FOOD_SPELLING_FIXES.put("بيتزا", List.of("بيتسا", "بيتزه"));
		FOOD_SPELLING_FIXES.put("شاورما", List.of("شورما", "شوارما", "شويرما", "شاورمه"));
		FOOD_SPELLING_FIXES.put("كابتشينو", List.of("كبتشينو", "كابوتشينو", "كابتشينه"));
		FOOD_SPELLING_FIXES.put("سندويش", List.of("سندوتش", "ساندويش", "سندويتش"));
		FOOD_SPELLING_FIXES.put("بطاطس", List.of("بطاطا", "بطاطص"));
		FOOD_SPELLING_FIXES.put("همبرجر", List.of("هامبرجر", "همبرقر", "هامبورجر", "هامبورغر"));
	}

	private static final Map<String, String> SPELLING_LOOKUP = buildSpellingLookup();

	private TextNormalizer() {
	}

	/**
	 * Normalizes text for comparison. Null is treated as empty.
	 */
	public static String normalize(String text) {
		if (text == null || text.isBlank()) {
			return "";
		}
		String result = TASHKEEL.matcher(text).replaceAll("");
		StringBuilder sb = new StringBuilder(result.length());
		for (int i = 0; i < result.length(); i++) {
			sb.append(foldLetter(result.charAt(i)));
		}
		result = WHITESPACE.matcher(sb.toString().trim()).replaceAll(" ");
		return fixSpellings(result).toLowerCase(Locale.ROOT);
	}

	/**
	 * Normalizes and then folds phonetically similar letters.
	 */
	public static String phonetic(String text) {
		String normalized = normalize(text);
		StringBuilder sb = new StringBuilder(normalized.length());
		for (int i = 0; i < normalized.length(); i++) {
			char c = normalized.charAt(i);
			switch (c) {
				case 'ق', 'ك' -> sb.append('ج');
				case 'س', 'ذ' -> sb.append('ز');
				default -> sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * Splits normalized text into tokens longer than two characters.
	 */
	public static List<String> significantTokens(String text) {
		String normalized = normalize(text);
		if (normalized.isEmpty()) {
			return List.of();
		}
		return WHITESPACE.splitAsStream(normalized)
				.filter(token -> token.length() > 2)
				.toList();
	}

	private static char foldLetter(char c) {
		return switch (c) {
			case 'أ', 'إ', 'آ', 'ٱ' -> 'ا';
			case 'ؤ' -> 'و';
			case 'ئ' -> 'ي';
			case 'ة' -> 'ه';
			case 'ى' -> 'ي';
			default -> c;
		};
	}

	private static String fixSpellings(String text) {
		if (text.isEmpty()) {
			return text;
		}
		String[] words = text.split(" ");
		for (int i = 0; i < words.length; i++) {
			String canonical = SPELLING_LOOKUP.get(words[i]);
			if (canonical != null) {
				words[i] = canonical;
			}
		}
		return String.join(" ", words);
	}

	// Variants are folded with the same letter rules so lookups match normalized words.
	private static Map<String, String> buildSpellingLookup() {
		Map<String, String> lookup = new LinkedHashMap<>();
		FOOD_SPELLING_FIXES.forEach((canonical, variants) -> {
			String folded = foldWord(canonical);
			for (String variant : variants) {
				lookup.put(foldWord(variant), folded);
			}
		});
		return Map.copyOf(lookup);
	}

	private static String foldWord(String word) {
		StringBuilder sb = new StringBuilder(word.length());
		for (int i = 0; i < word.length(); i++) {
			sb.append(foldLetter(word.charAt(i)));
		}
		return sb.toString();
	}
}
