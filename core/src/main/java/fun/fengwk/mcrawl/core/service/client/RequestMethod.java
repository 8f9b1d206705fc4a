package fun.fengwk.mcrawl.core.service.client;

/**
 * @author fengwk
 */
public enum RequestMethod {

    GET,
    POST

}
