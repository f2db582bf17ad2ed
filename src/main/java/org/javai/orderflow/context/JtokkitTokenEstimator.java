package org.javai.orderflow.context;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Token counts from the jtokkit BPE encodings. Defaults to {@code o200k_base}, the encoding of
 * the gpt-4o family.
 */
public class JtokkitTokenEstimator implements TokenEstimator {

	private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

	private final Encoding encoding;

	public JtokkitTokenEstimator() {
		this(EncodingType.O200K_BASE);
	}

	public JtokkitTokenEstimator(EncodingType type) {
		this.encoding = REGISTRY.getEncoding(type);
	}

	@Override
	public int count(String text) {
		if (text == null || text.isEmpty()) {
			return 0;
		}
		return encoding.countTokens(text);
	}
}
