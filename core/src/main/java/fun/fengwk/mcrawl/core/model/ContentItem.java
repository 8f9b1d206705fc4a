package fun.fengwk.mcrawl.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A note, video or post of a platform.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentItem {

    private String id;

    private String creatorId;

    private String title;

    /**
     * Platform specific fields as returned by the extraction layer.
     */
    private JsonNode payload;

}
