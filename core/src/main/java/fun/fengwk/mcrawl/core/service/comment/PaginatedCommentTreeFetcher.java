package fun.fengwk.mcrawl.core.service.comment;

import fun.fengwk.mcrawl.core.model.CommentNode;
import fun.fengwk.mcrawl.core.model.PageResult;
import fun.fengwk.mcrawl.core.service.client.PlatformApi;
import fun.fengwk.mcrawl.core.service.crawl.CancellationToken;
import fun.fengwk.mcrawl.core.service.crawl.CrawlTask;
import fun.fengwk.mcrawl.core.service.crawl.RequestExecutor;
import fun.fengwk.mcrawl.core.service.retry.BackoffScheduler;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Walks the two-level comment tree of one content.
 *
 * <p>The outer walk pages root comments, each delivered root with replies starts an inner walk over its
 * replies. Both walks stop when the platform reports no more pages or the shared max count is reached,
 * and every page request is followed by the crawl pause. Pages go to the sink as soon as they arrive.
 *
 * @author fengwk
 */
@Slf4j
public class PaginatedCommentTreeFetcher {

    private final PlatformApi platformApi;
    private final RequestExecutor requestExecutor;
    private final BackoffScheduler backoffScheduler;
    private final boolean fetchSubComments;
    private final CancellationToken cancellationToken;

    public PaginatedCommentTreeFetcher(PlatformApi platformApi, RequestExecutor requestExecutor,
                                       BackoffScheduler backoffScheduler, boolean fetchSubComments,
                                       CancellationToken cancellationToken) {
        this.platformApi = platformApi;
        this.requestExecutor = requestExecutor;
        this.backoffScheduler = backoffScheduler;
        this.fetchSubComments = fetchSubComments;
        this.cancellationToken = cancellationToken;
    }

    /**
     * Fetch the comment tree of a content.
     *
     * @param task      task owning the requests
     * @param contentId content whose comments are fetched
     * @param maxCount  max comments including replies, non-positive means unbounded
     * @param sink      receives every page
     * @return delivered counts
     */
    public CommentFetchResult fetchAllComments(CrawlTask task, String contentId, int maxCount, CommentPageSink sink) {
        WalkState walk = new WalkState(maxCount <= 0 ? Integer.MAX_VALUE : maxCount);
        String cursor = "";
        boolean hasMore = true;
        while (hasMore && walk.hasBudget() && !cancellationToken.isCancelled()) {
            String pageCursor = cursor;
            PageResult<CommentNode> page = requestExecutor.call(task, "comments",
                lease -> platformApi.getComments(contentId, pageCursor, lease));
            walk.pageRequests++;
            backoffScheduler.pause();

            List<CommentNode> roots = truncate(page.items(), walk.remaining());
            if (!roots.isEmpty()) {
                sink.onPage(contentId, roots);
                walk.rootComments += roots.size();
            }
            hasMore = page.hasMore() && !page.isEmpty();
            cursor = page.cursor();
            task.setCursor(cursor);

            if (fetchSubComments) {
                for (CommentNode root : roots) {
                    if (!walk.hasBudget() || cancellationToken.isCancelled()) {
                        break;
                    }
                    if (root.hasSubComments()) {
                        fetchSubComments(task, contentId, root, walk, sink);
                    }
                }
            }
        }
        log.debug("comment tree fetched, task={}, roots={}, replies={}, requests={}",
            task.describe(), walk.rootComments, walk.subComments, walk.pageRequests);
        return new CommentFetchResult(walk.rootComments, walk.subComments, walk.pageRequests);
    }

    private void fetchSubComments(CrawlTask task, String contentId, CommentNode root, WalkState walk,
                                  CommentPageSink sink) {
        int pageSize = Math.max(1, platformApi.subCommentPageSize());
        // in long, a count near Integer.MAX_VALUE would wrap
        long maxPages = ((long) root.getSubCommentCount() + pageSize - 1) / pageSize;
        long pages = 0;
        boolean hasMore = true;
        while (hasMore && pages < maxPages && walk.hasBudget() && !cancellationToken.isCancelled()) {
            String subCursor = root.getSubCursor() == null ? "" : root.getSubCursor();
            PageResult<CommentNode> page = requestExecutor.call(task, "sub-comments",
                lease -> platformApi.getSubComments(contentId, root, subCursor, lease));
            pages++;
            walk.pageRequests++;
            backoffScheduler.pause();

            List<CommentNode> replies = truncate(page.items(), walk.remaining());
            if (!replies.isEmpty()) {
                sink.onPage(contentId, replies);
                walk.subComments += replies.size();
            }
            root.setSubCursor(page.cursor());
            hasMore = page.hasMore() && !page.isEmpty();
        }
    }

    private List<CommentNode> truncate(List<CommentNode> items, int remaining) {
        if (items.size() <= remaining) {
            return items;
        }
        return items.subList(0, remaining);
    }

    private static final class WalkState {

        private final int maxCount;
        private int rootComments;
        private int subComments;
        private int pageRequests;

        private WalkState(int maxCount) {
            this.maxCount = maxCount;
        }

        private int remaining() {
            return Math.max(0, maxCount - rootComments - subComments);
        }

        private boolean hasBudget() {
            return remaining() > 0;
        }

    }

}
