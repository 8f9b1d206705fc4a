package fun.fengwk.mcrawl.core.service.comment;

import fun.fengwk.mcrawl.core.model.CommentNode;

import java.util.List;

/**
 * Receives comment pages as soon as they are fetched.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface CommentPageSink {

    void onPage(String contentId, List<CommentNode> comments);

}
