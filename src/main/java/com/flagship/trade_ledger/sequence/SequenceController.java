package com.flagship.trade_ledger.sequence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/sequences")
@RequiredArgsConstructor
@Slf4j
public class SequenceController {

    private final SequenceAllocator sequenceAllocator;

    @GetMapping("/{name}/peek")
    public ResponseEntity<Map<String, Object>> peek(@PathVariable("name") String name) {
        return ResponseEntity.ok(body(name, sequenceAllocator.peek(name)));
    }

    @PostMapping("/{name}/next")
    public ResponseEntity<Map<String, Object>> next(@PathVariable("name") String name) {
        long value = sequenceAllocator.next(name);
        log.info("Sequence value issued: name={}, value={}", name, value);
        return ResponseEntity.ok(body(name, value));
    }

    private static Map<String, Object> body(String name, long value) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("name", name);
        response.put("value", value);
        return response;
    }
}
