package com.autonomous.gateway.controller;

import com.autonomous.gateway.compression.ChatCompressionService;
import com.autonomous.gateway.compression.CompressionResult;
import com.autonomous.gateway.error.ValidationException;
import com.autonomous.gateway.model.ChatSession;
import com.autonomous.gateway.model.CompressionConfig;
import com.autonomous.gateway.model.ProviderType;
import com.autonomous.gateway.model.RequestParameters;
import com.autonomous.gateway.service.MessageResult;
import com.autonomous.gateway.service.SendMessageService;
import com.autonomous.gateway.service.SessionRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/chat")
public class ChatController {

    private final SendMessageService sendMessageService;
    private final SessionRepository sessionRepository;
    private final ChatCompressionService compressionService;

    public ChatController(SendMessageService sendMessageService, SessionRepository sessionRepository,
                          ChatCompressionService compressionService) {
        this.sendMessageService = sendMessageService;
        this.sessionRepository = sessionRepository;
        this.compressionService = compressionService;
    }

    @PostMapping("/send")
    public ResponseEntity<MessageResult> send(@RequestBody ChatSendRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            throw new ValidationException("Invalid chat request", List.of("Message must not be blank"));
        }
        ProviderType provider = parseProvider(request.getProviderId());

        RequestParameters.RequestParametersBuilder parameters = RequestParameters.builder();
        if (request.getTemperature() != null) {
            parameters.temperature(request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            parameters.maxTokens(request.getMaxTokens());
        }
        if (request.getResponseFormat() != null) {
            parameters.responseFormat(request.getResponseFormat());
        }

        MessageResult result = sendMessageService.sendMessage(request.getMessage(), request.getSessionId(),
            provider, request.getModel(), parameters.build()).getOrThrow();
        return ResponseEntity.ok(result);
    }

    @GetMapping("/sessions/{id}")
    public ResponseEntity<ChatSession> getSession(@PathVariable String id) {
        return ResponseEntity.ok(sessionRepository.getSession(id));
    }

    @PostMapping("/sessions/{id}/compress")
    public ResponseEntity<CompressionResult> compress(@PathVariable String id,
                                                      @RequestParam(defaultValue = "claude") String providerId,
                                                      @RequestParam(required = false) String model) {
        sessionRepository.getSession(id);
        CompressionResult result = compressionService.compressSession(id, parseProvider(providerId), model)
            .getOrThrow();
        return ResponseEntity.ok(result);
    }

    @GetMapping("/sessions/{id}/compression")
    public ResponseEntity<CompressionConfig> getCompressionConfig(@PathVariable String id) {
        return ResponseEntity.ok(sessionRepository.getSession(id).getCompressionConfig());
    }

    @PutMapping("/sessions/{id}/compression")
    public ResponseEntity<CompressionConfig> updateCompressionConfig(@PathVariable String id,
                                                                     @RequestBody CompressionConfig config) {
        validate(config);
        sessionRepository.getSession(id);
        compressionService.updateCompressionConfig(id, config);
        return ResponseEntity.ok(sessionRepository.getSession(id).getCompressionConfig());
    }

    /**
     * Reports whether the session's strategy would compress now. Token-based checks
     * need {@code contextWindowSize}; without it they report false.
     */
    @GetMapping("/sessions/{id}/compression/check")
    public ResponseEntity<CompressionCheckInfo> checkCompression(@PathVariable String id,
                                                                 @RequestParam(required = false) Integer contextWindowSize) {
        ChatSession session = sessionRepository.getSession(id);
        boolean shouldCompress = compressionService.shouldCompress(session, contextWindowSize);
        return ResponseEntity.ok(CompressionCheckInfo.of(session, shouldCompress));
    }

    static void validate(CompressionConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null || config.getStrategy() == null) {
            errors.add("Strategy is required");
        } else {
            if (config.getFullReplacementMessageThreshold() < 1) {
                errors.add("fullReplacementMessageThreshold must be at least 1");
            }
            if (config.getSlidingWindowKeepLast() < 0) {
                errors.add("slidingWindowKeepLast must not be negative");
            }
            if (config.getSlidingWindowMessageThreshold() <= config.getSlidingWindowKeepLast()) {
                errors.add("slidingWindowMessageThreshold must be greater than slidingWindowKeepLast");
            }
            if (!isFraction(config.getTokenBasedThresholdPercent())) {
                errors.add("tokenBasedThresholdPercent must be in (0, 1]");
            }
            if (!isFraction(config.getTokenBasedKeepPercent())) {
                errors.add("tokenBasedKeepPercent must be in (0, 1]");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid compression config", errors);
        }
    }

    private static boolean isFraction(double value) {
        return value > 0 && value <= 1;
    }

    static ProviderType parseProvider(String providerId) {
        return ProviderType.fromId(providerId)
            .orElseThrow(() -> new ValidationException("Invalid provider",
                List.of("Unknown provider: " + providerId)));
    }
}
