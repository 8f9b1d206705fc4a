package fun.fengwk.mcrawl.core.model;

/**
 * @author fengwk
 */
public enum RecordType {

    CONTENT,
    COMMENT,
    CREATOR

}
