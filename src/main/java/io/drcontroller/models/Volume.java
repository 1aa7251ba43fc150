package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Replicated volume. Carries either a direct share or qtrees with their own shares, never both.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Volume {

    @JsonProperty("volume_name")
    private String name;

    @JsonProperty("share")
    private Share share;

    @JsonProperty("qtrees")
    private List<Qtree> qtrees = new ArrayList<>();

    public Volume(String name) {
        this.name = name;
    }

    /**
     * All shares of this volume in declaration order.
     */
    @JsonIgnore
    public List<Share> getShares() {
        List<Share> shares = new ArrayList<>();
        if (share != null) {
            shares.add(share);
        }
        if (qtrees != null) {
            for (Qtree qtree : qtrees) {
                if (qtree.getShare() != null) {
                    shares.add(qtree.getShare());
                }
            }
        }
        return shares;
    }
}
