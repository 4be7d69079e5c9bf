package com.lawgraph.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.lawgraph.service.data.DictionaryLoaderService;
import com.lawgraph.service.verify.VerificationService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final DictionaryLoaderService dictionaryLoaderService;
    private final VerificationService verificationService;

    @Override
    public void run(ApplicationArguments args) {
        log.info("\n{}", "=".repeat(70));
        log.info("INITIALIZING LAW GRAPH ENGINE");
        log.info("{}\n", "=".repeat(70));

        try {
            int laws = dictionaryLoaderService.getDictionary().size();
            if (laws == 0) {
                log.warn("Law dictionary is empty: every external citation will be unresolved");
            } else {
                log.info("Law dictionary ready ({} laws)", laws);
            }
            log.info("Citation verifier {}", verificationService.isActive() ? "active" : "off");

            log.info("\n{}", "=".repeat(70));
            log.info("SYSTEM READY");
            log.info("{}\n", "=".repeat(70));

        } catch (Exception e) {
            log.error("\n{}", "=".repeat(70));
            log.error("INITIALIZATION FAILED");
            log.error("{}\n", "=".repeat(70));
            log.error("Error: {}", e.getMessage(), e);
            log.warn("Application started but some features may not work");
        }
    }
}
