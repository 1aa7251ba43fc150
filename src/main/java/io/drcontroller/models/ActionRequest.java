package io.drcontroller.models;

import io.drcontroller.enums.DrAction;
import io.drcontroller.enums.ExecutionPolicy;
import io.drcontroller.enums.RestorationPath;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An operator's request to run one action. Empty targets mean every volume of the application.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ActionRequest {

    private DrAction action;

    @Builder.Default
    private List<String> targets = new ArrayList<>();

    @Builder.Default
    private ExecutionPolicy policy = ExecutionPolicy.SEQUENTIAL;

    private RestorationPath restorationPath;

    private boolean dryRun;

    private String operator;

    public boolean isWholeApplication() {
        return targets == null || targets.isEmpty();
    }
}
