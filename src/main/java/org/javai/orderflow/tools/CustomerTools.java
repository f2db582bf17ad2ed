package org.javai.orderflow.tools;

import java.util.Map;
import java.util.Objects;
import org.javai.orderflow.ErrorKind;
import org.javai.orderflow.OrderingException;
import org.javai.orderflow.context.ContextSynthesizer;
import org.javai.orderflow.session.FulfilmentMode;
import org.javai.orderflow.session.SessionRecord;

/**
 * Customer identity and fulfilment-mode handlers. All setters are idempotent.
 */
class CustomerTools {

	private final ContextSynthesizer synthesizer;

	CustomerTools(ContextSynthesizer synthesizer) {
		this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
	}

	ToolOutcome setMode(SessionRecord session, ToolArguments.SetMode args) {
		FulfilmentMode mode = FulfilmentMode.parse(args.mode()).orElseThrow(() -> new OrderingException(
				ErrorKind.INVALID_ARGUMENT, "Mode must be delivery or pickup, got '" + args.mode() + "'"));
		boolean changed = session.selectMode(mode);
		return ToolOutcome.of(changed ? "Mode set to " + mode.wireName() : "Mode already " + mode.wireName(),
				Map.of("mode", mode.wireName(), "changed", changed));
	}

	ToolOutcome setName(SessionRecord session, ToolArguments.CustomerName args) {
		boolean changed = session.setCustomerName(args.name());
		return ToolOutcome.of(changed ? "Name recorded" : "Name already set",
				Map.of("name", session.customerName().orElse(""), "changed", changed));
	}

	ToolOutcome setPhone(SessionRecord session, ToolArguments.PhoneNumber args) {
		boolean changed = session.setPhoneNumber(args.phone());
		return ToolOutcome.of(changed ? "Phone recorded" : "Phone already set",
				Map.of("phone", session.phoneNumber().orElse(""), "changed", changed));
	}

	ToolOutcome sessionState(SessionRecord session) {
		return ToolOutcome.of(synthesizer.stateBlock(session));
	}
}
