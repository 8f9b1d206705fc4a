package fun.fengwk.mcrawl.core.service.client;

import fun.fengwk.mcrawl.core.model.CommentNode;
import fun.fengwk.mcrawl.core.model.ContentItem;
import fun.fengwk.mcrawl.core.model.CreatorProfile;
import fun.fengwk.mcrawl.core.model.PageResult;
import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.login.SessionState;

import java.util.Map;

/**
 * Typed operations of one platform, implemented by the platform extraction layer.
 *
 * <p>Every call receives the proxy lease owned by the calling task, null when proxies are disabled.
 * Failures are reported with the crawl exception taxonomy, absence of further pages is reported through
 * {@link PageResult#hasMore()}.
 *
 * @author fengwk
 */
public interface PlatformApi {

    Platform platform();

    PageResult<ContentItem> search(SearchQuery query, ProxyLease lease);

    ContentItem getDetail(String contentId, ProxyLease lease);

    CreatorProfile getCreatorProfile(String creatorId, ProxyLease lease);

    PageResult<ContentItem> getCreatorContents(String creatorId, String cursor, ProxyLease lease);

    PageResult<CommentNode> getComments(String contentId, String cursor, ProxyLease lease);

    PageResult<CommentNode> getSubComments(String contentId, CommentNode root, String cursor, ProxyLease lease);

    /**
     * Lightweight authenticated probe.
     */
    boolean pong(SessionState session, ProxyLease lease);

    /**
     * Cheap login check on cookies alone, false when undecidable.
     */
    default boolean hasLoginCookie(Map<String, String> cookies) {
        return false;
    }

    /**
     * Called once the session is logged in, before any crawl request.
     */
    default void updateCookies(SessionState session) {
    }

    default int subCommentPageSize() {
        return 10;
    }

}
