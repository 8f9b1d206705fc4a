package fun.fengwk.mcrawl.core.service.client;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @author fengwk
 */
@Data
@Builder
public class PlatformRequest {

    @Builder.Default
    private RequestMethod method = RequestMethod.GET;

    /**
     * Path relative to the client base url, or an absolute url.
     */
    private String uri;

    @Builder.Default
    private Map<String, String> params = new LinkedHashMap<>();

    /**
     * Json body of POST requests.
     */
    private String body;

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

}
