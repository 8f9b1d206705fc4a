package fun.fengwk.mcrawl.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unit handed to the persistence sink.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrawlRecord {

    private Platform platform;

    private RecordType type;

    private String id;

    /**
     * Content id for comments, creator id for content found through a creator.
     */
    private String parentId;

    /**
     * Search keyword that led to the record, if any.
     */
    private String sourceKeyword;

    private JsonNode payload;

    public static CrawlRecord content(Platform platform, ContentItem item, String sourceKeyword) {
        return CrawlRecord.builder()
            .platform(platform)
            .type(RecordType.CONTENT)
            .id(item.getId())
            .parentId(item.getCreatorId())
            .sourceKeyword(sourceKeyword)
            .payload(item.getPayload())
            .build();
    }

    public static CrawlRecord comment(Platform platform, CommentNode comment) {
        return CrawlRecord.builder()
            .platform(platform)
            .type(RecordType.COMMENT)
            .id(comment.getId())
            .parentId(comment.getContentId())
            .payload(comment.getPayload())
            .build();
    }

    public static CrawlRecord creator(Platform platform, CreatorProfile profile) {
        return CrawlRecord.builder()
            .platform(platform)
            .type(RecordType.CREATOR)
            .id(profile.getId())
            .payload(profile.getPayload())
            .build();
    }

}
