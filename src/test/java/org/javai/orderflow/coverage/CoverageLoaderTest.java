package org.javai.orderflow.coverage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.javai.orderflow.testsupport.TestFixtures;
import org.junit.jupiter.api.Test;

class CoverageLoaderTest {

	@Test
	void loadsZonesInFileOrder() {
		CoverageMap coverage = TestFixtures.coverage();

		assertThat(coverage.zones()).extracting(CoverageZone::district)
				.containsExactly("النرجس", "الياسمين", "العليا", "الملقا", "حطين", "الصحافة");
		assertThat(coverage.match("الصحافة").orElseThrow().estimatedTime()).isEmpty();
	}

	@Test
	void nonNumericFeeIsRejected() {
		byte[] json = "{\"النرجس\": {\"delivery_fee\": \"free\"}}".getBytes(StandardCharsets.UTF_8);

		assertThatThrownBy(() -> new CoverageLoader().load(new ByteArrayInputStream(json)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("delivery_fee");
	}

	@Test
	void missingResourceIsReported() {
		assertThatThrownBy(() -> new CoverageLoader().loadResource("/nowhere.json"))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
