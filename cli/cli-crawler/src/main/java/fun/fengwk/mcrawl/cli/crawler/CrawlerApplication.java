package fun.fengwk.mcrawl.cli.crawler;

import fun.fengwk.mcrawl.core.service.proxy.ProxyHttpClients;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */

@SpringBootApplication(scanBasePackages = "fun.fengwk.mcrawl")
public class CrawlerApplication {

    public static void main(String[] args) {
        ProxyHttpClients.enableTunnelBasicAuth();
        SpringApplication.run(CrawlerApplication.class, args);
    }

}
