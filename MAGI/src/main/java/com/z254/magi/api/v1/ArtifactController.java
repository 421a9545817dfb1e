package com.z254.magi.api.v1;

import com.z254.magi.api.dto.ApiResponses;
import com.z254.magi.service.SessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Read-only view of processed code bundles.
 */
@RestController
@RequestMapping("/api/v1/artifacts")
@Tag(name = "Artifacts", description = "Processed code bundle summaries")
public class ArtifactController {

    private final SessionService sessionService;

    public ArtifactController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get artifact", description = "Artifact status and manifest, visible to its owner only")
    @ApiResponse(responseCode = "200", description = "Artifact found")
    @ApiResponse(responseCode = "404", description = "Artifact not found")
    public Mono<ApiResponses.ArtifactDetail> getArtifact(
            @Parameter(description = "Artifact ID") @PathVariable String id,
            @Parameter(description = "Requesting user") @RequestParam(required = false) String userId) {
        return sessionService.getArtifact(id, userId)
                .map(ApiResponses.ArtifactDetail::new);
    }
}
