package org.javai.orderflow.orchestration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks allergies and dietary restrictions out of customer text so they survive every handoff.
 * Best effort: a miss only means the model has to carry the constraint from the conversation.
 */
public class ConstraintDetector {

	private record Rule(Pattern pattern, Function<Matcher, String> render) {
	}

	private static final List<Rule> RULES = List.of(
			// general dietary rules
			new Rule(Pattern.compile("حساسية.*من (.+)"), m -> "حساسية من " + m.group(1).strip()),
			new Rule(Pattern.compile("(نباتي|vegan)", Pattern.CASE_INSENSITIVE), m -> "نظام غذائي: نباتي"),
			new Rule(Pattern.compile("بدون (.+) في كل"), m -> "قيد عام: بدون " + m.group(1).strip()),
			new Rule(Pattern.compile("(حلال فقط|halal only)", Pattern.CASE_INSENSITIVE), m -> "حلال فقط"),
			// safety phrases, kept verbatim
			new Rule(Pattern.compile("حساسية\\s+(?:من\\s+)?(\\S+)"), m -> "حساسية: " + m.group()),
			new Rule(Pattern.compile("عندي\\s+حساسية"), m -> "حساسية: " + m.group()),
			new Rule(Pattern.compile("ما\\s*[أا]كل\\s+(\\S+)"), m -> "لا يأكل: " + m.group()),
			new Rule(Pattern.compile("بدون\\s+(\\S+)"), m -> "بدون: " + m.group()));

	/**
	 * @return constraints found in the text, in rule order, without duplicates
	 */
	public List<String> detect(String text) {
		if (text == null || text.isBlank()) {
			return List.of();
		}
		Set<String> found = new LinkedHashSet<>();
		for (Rule rule : RULES) {
			Matcher matcher = rule.pattern().matcher(text);
			if (matcher.find()) {
				found.add(rule.render().apply(matcher));
			}
		}
		return new ArrayList<>(found);
	}
}
