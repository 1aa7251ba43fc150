package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * CIFS share exposing a volume or qtree junction path.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Share {

    @JsonProperty("share_name")
    private String name;

    @JsonProperty("path")
    private String path; // "/<volume>" or "/<volume>/<qtree>"
}
