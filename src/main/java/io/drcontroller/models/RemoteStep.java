package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.enums.AwaitCondition;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.enums.Site;
import io.drcontroller.enums.StepKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One planned remote step of a relationship's workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RemoteStep {

    @JsonProperty("site")
    private Site site;

    @JsonProperty("cluster")
    private String cluster;

    @JsonProperty("kind")
    private StepKind kind;

    @JsonProperty("command")
    private String command;

    // create command for ENSURE_SHARE and CREATE_LINK_IF_ABSENT
    @JsonProperty("conditional_command")
    private String conditionalCommand;

    @JsonProperty("await")
    private AwaitCondition await;

    // relationship polled by AWAIT and CREATE_LINK_IF_ABSENT
    @JsonProperty("link")
    private ReplicationLink link;

    /**
     * Commands this step may send, in order, for preview output.
     */
    public String describe() {
        switch (kind) {
            case AWAIT:
                return "wait for " + link + " " + await.name().toLowerCase() + " [" + command + "]";
            case ENSURE_SHARE:
            case CREATE_LINK_IF_ABSENT:
                return command + " ; if absent: " + conditionalCommand;
            default:
                return command;
        }
    }

    public boolean isMutating() {
        return kind != StepKind.AWAIT;
    }
}
