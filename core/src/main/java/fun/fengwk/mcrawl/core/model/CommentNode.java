package fun.fengwk.mcrawl.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A root comment or a reply.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentNode {

    private String id;

    private String contentId;

    /**
     * Root comment id for replies, null for root comments.
     */
    private String parentId;

    /**
     * Reply count reported by the platform, 0 means no reply walk.
     */
    private int subCommentCount;

    /**
     * Cursor of the reply listing, advanced while replies are fetched.
     */
    private String subCursor;

    private JsonNode payload;

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean hasSubComments() {
        return subCommentCount > 0;
    }

}
