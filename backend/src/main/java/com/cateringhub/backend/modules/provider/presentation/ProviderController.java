package com.cateringhub.backend.modules.provider.presentation;

import java.net.URI;

import com.cateringhub.backend.global.security.SecurityUtils;
import com.cateringhub.backend.global.web.RequestOrigin;
import com.cateringhub.backend.modules.provider.application.ProviderService;
import com.cateringhub.backend.modules.provider.application.ProviderView;
import com.cateringhub.backend.modules.provider.presentation.dto.CreateProviderRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProviderController {

    private final ProviderService providerService;

    public ProviderController(ProviderService providerService) {
        this.providerService = providerService;
    }

    @Operation(summary = "Create provider", description = "Creates a catering provider and makes the caller its owner.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Provider created"),
            @ApiResponse(responseCode = "422", description = "Invalid name")
    })
    @PostMapping("/providers")
    public ResponseEntity<ProviderView> createProvider(
            @Valid @RequestBody CreateProviderRequest request,
            HttpServletRequest httpRequest
    ) {
        ProviderView view = providerService.createProvider(SecurityUtils.getCurrentUserId(), request.name(),
                RequestOrigin.from(httpRequest));
        return ResponseEntity.created(URI.create("/providers/" + view.id())).body(view);
    }
}
