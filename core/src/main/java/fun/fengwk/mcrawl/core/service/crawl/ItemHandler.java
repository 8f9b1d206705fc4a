package fun.fengwk.mcrawl.core.service.crawl;

/**
 * @author fengwk
 */
@FunctionalInterface
public interface ItemHandler<T, R> {

    R handle(T item) throws Exception;

}
