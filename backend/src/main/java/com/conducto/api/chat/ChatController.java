/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.api.chat;

import com.conducto.application.routing.ChatRequest;
import com.conducto.application.routing.InferenceRouter;
import com.conducto.application.routing.RoutedResponse;
import com.conducto.config.RequestContextFilter;
import com.conducto.domain.model.ChatMessage;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/ai")
public class ChatController {
    private final InferenceRouter inferenceRouter;

    public ChatController(InferenceRouter inferenceRouter) {
        this.inferenceRouter = inferenceRouter;
    }

    @PostMapping("/chat")
    public RoutedResponse chat(
            @RequestHeader(value = RequestContextFilter.CALLER_HEADER, required = false) String callerId,
            @Valid @RequestBody ChatCompletionRequest req
    ) {
        return inferenceRouter.route(
                new ChatRequest(req.messages(), req.temperature(), req.maxTokens(), req.deadlineMs()),
                callerId
        );
    }

    public record ChatCompletionRequest(
            @NotEmpty List<@Valid ChatMessage> messages,
            @DecimalMin("0.0") @DecimalMax("2.0") Double temperature,
            @Min(1) @Max(32768) Integer maxTokens,
            @Positive Long deadlineMs
    ) {}
}
