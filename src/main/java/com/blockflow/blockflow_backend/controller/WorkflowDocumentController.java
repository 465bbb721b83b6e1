package com.blockflow.blockflow_backend.controller;

import com.blockflow.blockflow_backend.document.ImportPolicy;
import com.blockflow.blockflow_backend.document.ImportResult;
import com.blockflow.blockflow_backend.service.WorkflowEditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/workflows/{workflowId}/yaml")
@RequiredArgsConstructor
public class WorkflowDocumentController {

    private final WorkflowEditService editService;

    @GetMapping(produces = "application/x-yaml")
    public String export(@PathVariable String workflowId) {
        return editService.exportYaml(workflowId);
    }

    // POST /api/workflows/{id}/yaml?policy=merge: policy defaults to fresh
    @PostMapping(consumes = {"application/x-yaml", MediaType.TEXT_PLAIN_VALUE}, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> importYaml(@PathVariable String workflowId,
                                        @RequestParam(defaultValue = "fresh") String policy,
                                        @RequestBody String yaml) {
        ImportPolicy importPolicy;
        try {
            importPolicy = ImportPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown import policy: " + policy));
        }
        ImportResult result = editService.importYaml(workflowId, yaml, importPolicy);
        if (!result.success()) {
            return ResponseEntity.badRequest().body(result);
        }
        return ResponseEntity.ok(result);
    }
}
