package com.phillippitts.platemate.presentation.controller;

import com.phillippitts.platemate.domain.ChatMessage;
import com.phillippitts.platemate.domain.RestaurantRecord;
import com.phillippitts.platemate.domain.UserPreferences.SortOption;
import com.phillippitts.platemate.exception.PermissionDeniedException;
import com.phillippitts.platemate.service.location.LocationResolver;
import com.phillippitts.platemate.service.session.ConnectionState;
import com.phillippitts.platemate.service.session.RestaurantFilter;
import com.phillippitts.platemate.service.session.SessionController;
import com.phillippitts.platemate.service.session.SubmitResult;
import com.phillippitts.platemate.service.speech.SpeechCaptureService;
import com.phillippitts.platemate.service.speech.StartResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * HTTP stand-in for the chat screen.
 *
 * <p>Every call delegates to {@link SessionController}, {@link SpeechCaptureService} or
 * {@link LocationResolver}. Replies to queries arrive asynchronously, so {@code POST /messages}
 * answers 202 and clients poll {@code GET /messages}.
 */
@RestController
@RequestMapping("/api")
class AssistantController {

    private static final Logger LOG = LogManager.getLogger(AssistantController.class);

    private final SessionController session;
    private final SpeechCaptureService speech;
    private final LocationResolver location;

    AssistantController(SessionController session, SpeechCaptureService speech, LocationResolver location) {
        this.session = session;
        this.speech = speech;
        this.location = location;
    }

    record MessageRequest(String text) {}

    // Session

    @PostMapping("/session/connect")
    ResponseEntity<Map<String, Object>> connect() {
        ConnectionState state = session.connect();
        HttpStatus status = state == ConnectionState.CONNECTED ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(sessionView());
    }

    @PostMapping("/session/disconnect")
    ResponseEntity<Map<String, Object>> disconnect() {
        session.disconnect();
        return ResponseEntity.ok(sessionView());
    }

    @GetMapping("/session")
    ResponseEntity<Map<String, Object>> session() {
        return ResponseEntity.ok(sessionView());
    }

    @PostMapping("/session/location-request/ack")
    ResponseEntity<Map<String, Object>> acknowledgeLocationRequest() {
        session.acknowledgeLocationRequest();
        return ResponseEntity.ok(sessionView());
    }

    // Messages

    @PostMapping("/messages")
    ResponseEntity<Map<String, Object>> submit(@RequestBody MessageRequest request) {
        SubmitResult result = session.submitUserText(request == null ? null : request.text());
        HttpStatus status = switch (result) {
            case ACCEPTED -> HttpStatus.ACCEPTED;
            case REJECTED_BUSY -> HttpStatus.CONFLICT;
            case REJECTED_EMPTY -> HttpStatus.BAD_REQUEST;
            case REJECTED_NOT_CONNECTED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        LOG.debug("Submit result: {}", result);
        return ResponseEntity.status(status).body(Map.of("result", result.name()));
    }

    @GetMapping("/messages")
    List<ChatMessage> history() {
        return session.history();
    }

    @DeleteMapping("/messages")
    ResponseEntity<Void> clearHistory() {
        session.clearHistory();
        return ResponseEntity.noContent().build();
    }

    // Voice

    @PostMapping("/voice/start")
    ResponseEntity<Map<String, Object>> startVoice() {
        StartResult result = speech.startListening();
        if (result == StartResult.PERMISSION_DENIED) {
            throw new PermissionDeniedException("microphone");
        }
        HttpStatus status = switch (result) {
            case STARTED -> HttpStatus.OK;
            case ALREADY_ACTIVE -> HttpStatus.CONFLICT;
            default -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        return ResponseEntity.status(status).body(Map.of("result", result.name(), "state", speech.state().name()));
    }

    @PostMapping("/voice/stop")
    ResponseEntity<Map<String, Object>> stopVoice() {
        speech.stopListening();
        return ResponseEntity.ok(voiceView());
    }

    @GetMapping("/voice")
    ResponseEntity<Map<String, Object>> voice() {
        return ResponseEntity.ok(voiceView());
    }

    // Location

    @GetMapping("/location")
    ResponseEntity<Map<String, Object>> location() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("permission", location.permissionStatus().name());
        body.put("available", location.isLocationAvailable());
        body.put("placeName", location.placeName());
        location.currentFix().ifPresent(fix -> body.put("fix", fix));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/location/permission")
    ResponseEntity<Map<String, Object>> requestLocationPermission() {
        return ResponseEntity.ok(Map.of("permission", location.requestPermission().name()));
    }

    // Restaurants

    @GetMapping("/restaurants")
    List<RestaurantRecord> restaurants(@RequestParam(required = false) String query,
                                       @RequestParam(required = false) Set<String> cuisine,
                                       @RequestParam(required = false) Integer maxPrice,
                                       @RequestParam(required = false) Double minRating,
                                       @RequestParam(required = false) String sort) {
        SortOption order = sort == null ? session.defaultSort() : SortOption.valueOf(sort.toUpperCase(Locale.ROOT));
        return session.filterRestaurants(new RestaurantFilter(query, cuisine, maxPrice, minRating, order));
    }

    @GetMapping("/suggestions")
    List<String> suggestions() {
        return session.suggestedQueries();
    }

    @GetMapping("/cuisines")
    List<String> cuisines() {
        return session.availableCuisines();
    }

    // Favorites

    @PostMapping("/favorites/{id}")
    ResponseEntity<Map<String, Object>> toggleFavorite(@PathVariable String id) {
        return session.toggleFavorite(id)
                .map(fav -> ResponseEntity.ok(Map.<String, Object>of("id", id, "favorite", fav)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("id", id)));
    }

    @GetMapping("/favorites")
    List<RestaurantRecord> favorites() {
        return session.favorites();
    }

    private Map<String, Object> sessionView() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("state", session.state().name());
        body.put("processing", session.isProcessing());
        body.put("locationRequestPending", session.isLocationRequestPending());
        return body;
    }

    private Map<String, Object> voiceView() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("enabled", speech.isVoiceInputEnabled());
        body.put("state", speech.state().name());
        body.put("transcription", speech.currentTranscription());
        return body;
    }
}
