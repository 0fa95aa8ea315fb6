package com.voxagent.gateway.http;

import com.voxagent.sessions.SessionRegistry;
import com.voxagent.sessions.SessionUsageTracker;
import com.voxagent.tools.ToolKind;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

@RestController
public class TurnController {

    private final SessionRegistry sessions;
    private final SessionUsageTracker usage;

    public TurnController(SessionRegistry sessions, SessionUsageTracker usage) {
        this.sessions = sessions;
        this.usage = usage;
    }

    @PostMapping("/v1/sessions/{id}/turns")
    public ResponseEntity<Map<String, Object>> turn(@PathVariable("id") String id,
                                                    @RequestBody Map<String, String> body) {
        var message = body.getOrDefault("message", "");
        if (message == null || message.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "message must not be empty"));
        }
        MDC.put("sessionId", id);
        try {
            var turn = sessions.getOrCreate(id).handleTurn(message);
            var out = new LinkedHashMap<String, Object>();
            out.put("reply", turn.reply());
            out.put("agent", turn.agentName());
            out.put("toolsUsed", turn.toolsUsed().stream().map(ToolKind::id).toList());
            out.put("agentsUsed", turn.agentsUsed());
            out.put("parallel", turn.parallel());
            return ResponseEntity.ok(out);
        } catch (CancellationException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "turn cancelled"));
        } finally {
            MDC.remove("sessionId");
        }
    }

    @GetMapping("/v1/sessions/{id}")
    public ResponseEntity<Map<String, Object>> session(@PathVariable("id") String id) {
        var found = sessions.get(id);
        if (found.isEmpty()) return ResponseEntity.notFound().build();
        var orchestrator = found.get();
        var out = new LinkedHashMap<String, Object>();
        out.put("sessionId", id);
        out.put("greeting", orchestrator.greeting());
        out.put("currentAgent", orchestrator.currentAgent().name());
        usage.summary(id).ifPresent(s -> {
            out.put("turns", s.turns());
            out.put("agentSwitches", s.agentSwitches());
            out.put("toolsUsed", s.toolsUsed().stream().map(ToolKind::id).sorted().toList());
            out.put("agentsUsed", s.agentsUsed());
        });
        return ResponseEntity.ok(out);
    }

    @PostMapping("/v1/sessions/{id}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable("id") String id) {
        var orchestrator = sessions.get(id);
        if (orchestrator.isEmpty()) return ResponseEntity.notFound().build();
        orchestrator.get().cancelTurn();
        return ResponseEntity.accepted().build();
    }

    @DeleteMapping("/v1/sessions/{id}")
    public ResponseEntity<Void> end(@PathVariable("id") String id) {
        return sessions.end(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
