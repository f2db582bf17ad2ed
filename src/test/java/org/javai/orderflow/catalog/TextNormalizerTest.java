package org.javai.orderflow.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

	@Test
	void foldsAlefVariantsAndTaaMarbuta() {
		assertThat(TextNormalizer.normalize("أرز")).isEqualTo("ارز");
		assertThat(TextNormalizer.normalize("إدام")).isEqualTo("ادام");
		assertThat(TextNormalizer.normalize("كبسة")).isEqualTo("كبسه");
		assertThat(TextNormalizer.normalize("مقهى")).isEqualTo("مقهي");
	}

	@Test
	void stripsDiacriticsAndTatweel() {
		assertThat(TextNormalizer.normalize("كَبْسَة")).isEqualTo("كبسه");
		assertThat(TextNormalizer.normalize("شـاورمـا")).isEqualTo("شاورما");
	}

	@Test
	void collapsesWhitespaceAndLowerCases() {
		assertThat(TextNormalizer.normalize("  Burger   لحم ")).isEqualTo("burger لحم");
	}

	@Test
	void fixesDialectSpellingsWordByWord() {
		assertThat(TextNormalizer.normalize("برقر لحم")).isEqualTo("برجر لحم");
		assertThat(TextNormalizer.normalize("شوارما دجاج")).isEqualTo("شاورما دجاج");
		// only whole words are replaced
		assertThat(TextNormalizer.normalize("برقرات")).isEqualTo("برقرات");
	}

	@Test
	void nullAndBlankNormalizeToEmpty() {
		assertThat(TextNormalizer.normalize(null)).isEmpty();
		assertThat(TextNormalizer.normalize("   ")).isEmpty();
	}

	@Test
	void phoneticFoldsSimilarSoundingLetters() {
		assertThat(TextNormalizer.phonetic("قنافة")).isEqualTo(TextNormalizer.phonetic("كنافة"));
		assertThat(TextNormalizer.phonetic("ذرة")).isEqualTo(TextNormalizer.phonetic("سرة"));
	}

	@Test
	void significantTokensDropShortWords() {
		assertThat(TextNormalizer.significantTokens("كبسة مع لحم")).containsExactly("كبسه", "لحم");
		assertThat(TextNormalizer.significantTokens("")).isEmpty();
	}
}
