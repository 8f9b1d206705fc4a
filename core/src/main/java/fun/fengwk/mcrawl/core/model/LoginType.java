package fun.fengwk.mcrawl.core.model;

/**
 * @author fengwk
 */
public enum LoginType {

    QRCODE,
    PHONE,
    COOKIE

}
