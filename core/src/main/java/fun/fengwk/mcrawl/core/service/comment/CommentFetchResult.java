package fun.fengwk.mcrawl.core.service.comment;

/**
 * @param rootComments root comments delivered
 * @param subComments  replies delivered
 * @param pageRequests page requests issued, outer and inner
 * @author fengwk
 */
public record CommentFetchResult(int rootComments, int subComments, int pageRequests) {

    public int total() {
        return rootComments + subComments;
    }

}
