package net.riseadvisor.util.image;

import java.util.List;
import net.riseadvisor.model.image.CheckType;
import net.riseadvisor.model.image.QualityIssue;

/**
 * Common view of one analyzer's output: the sub-score it contributes to the
 * aggregate and the issues it detected, in detection order.
 */
public interface CheckOutcome {

    CheckType checkType();

    /** Sub-score before clamping; values above 1.0 mean the requirement is met with margin. */
    double subScore();

    List<QualityIssue> issues();
}
