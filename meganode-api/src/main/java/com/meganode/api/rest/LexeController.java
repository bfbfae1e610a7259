package com.meganode.api.rest;

import com.meganode.engine.MegaNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator endpoints.
 */
@RestController
@RequestMapping("/lexe")
public class LexeController {

    private final MegaNode megaNode;

    public LexeController(MegaNode megaNode) {
        this.megaNode = megaNode;
    }

    /**
     * Shut the meganode down: every user node is stopped, then the process exits.
     */
    @PostMapping("/shutdown")
    public ResponseEntity<Map<String, Object>> shutdown() {
        boolean initiated = megaNode.requestShutdown("requested");
        return ResponseEntity.ok(Map.of("shutdown", true, "initiated", initiated));
    }
}
