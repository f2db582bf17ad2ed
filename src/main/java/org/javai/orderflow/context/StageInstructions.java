package org.javai.orderflow.context;

import java.util.List;
import org.javai.orderflow.session.Stage;

/**
 * Source of the instruction text for each stage.
 */
public interface StageInstructions {

	/**
	 * @param stage the stage about to run
	 * @param constraints the session's constraints, echoed into every stage's instructions
	 */
	String instructionsFor(Stage stage, List<String> constraints);
}
