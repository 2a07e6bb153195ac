package com.phillippitts.scantomack;

import com.phillippitts.scantomack.config.ocr.TesseractConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        TesseractConfig.class,
        com.phillippitts.scantomack.config.properties.BridgeProperties.class,
        com.phillippitts.scantomack.config.properties.ThreadPoolProperties.class,
        com.phillippitts.scantomack.config.properties.OrchestrationProperties.class,
        com.phillippitts.scantomack.config.properties.EnsembleProperties.class,
        com.phillippitts.scantomack.config.properties.CacheProperties.class
})
public class ScanToMackApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanToMackApplication.class, args);
    }

}
