package fun.fengwk.mcrawl.core.service.client;

import fun.fengwk.mcrawl.core.model.search.PlatformSearchConfig;

/**
 * @param keyword keyword searched
 * @param page    page number, starting at the configured start page
 * @param cursor  cursor returned with the previous page, empty on the first page
 * @param config  platform search settings
 * @author fengwk
 */
public record SearchQuery(String keyword, int page, String cursor, PlatformSearchConfig config) {

}
