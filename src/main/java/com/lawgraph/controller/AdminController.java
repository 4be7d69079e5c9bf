package com.lawgraph.controller;

import com.lawgraph.service.data.DictionaryLoaderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final DictionaryLoaderService dictionaryLoaderService;

    @PostMapping("/reload-dictionary")
    public ResponseEntity<?> reloadDictionary() {
        try {
            int laws = dictionaryLoaderService.reload();
            return ResponseEntity.ok(Map.of("status", "reloaded", "laws", laws));
        } catch (Exception e) {
            log.error("Dictionary reload failed", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/dictionary")
    public ResponseEntity<?> dictionaryStatistics() {
        return ResponseEntity.ok(dictionaryLoaderService.getStatistics());
    }
}
