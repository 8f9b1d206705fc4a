package fun.fengwk.mcrawl.core.service.client;

/**
 * Raw platform response, body is json or html.
 *
 * @author fengwk
 */
public record PlatformResponse(int statusCode, String body) {

}
