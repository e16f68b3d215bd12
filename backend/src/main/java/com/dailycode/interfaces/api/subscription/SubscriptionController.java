package com.dailycode.interfaces.api.subscription;

import com.dailycode.application.subscription.SubscriberStats;
import com.dailycode.application.subscription.SubscriptionResult;
import com.dailycode.application.subscription.SubscriptionService;
import com.dailycode.interfaces.api.dto.SubscribeRequest;
import com.dailycode.interfaces.api.dto.SubscriberResponse;
import com.dailycode.interfaces.api.dto.UpdatePreferencesRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @PostMapping
    public ResponseEntity<SubscriberResponse> subscribe(@Valid @RequestBody SubscribeRequest request) {
        SubscriptionResult result = subscriptionService.subscribe(
                request.email(), request.language(), request.difficulty());
        return ResponseEntity.status(result.reactivated() ? HttpStatus.OK : HttpStatus.CREATED)
                .body(SubscriberResponse.from(result.subscriber()));
    }

    @DeleteMapping("/{email}")
    public ResponseEntity<SubscriberResponse> unsubscribe(@PathVariable String email) {
        return ResponseEntity.ok(SubscriberResponse.from(subscriptionService.unsubscribe(email)));
    }

    @PatchMapping("/{email}")
    public ResponseEntity<SubscriberResponse> updatePreferences(@PathVariable String email,
                                                                @RequestBody UpdatePreferencesRequest request) {
        return ResponseEntity.ok(SubscriberResponse.from(
                subscriptionService.updatePreferences(email, request.language(), request.difficulty())));
    }

    @GetMapping("/{email}/stats")
    public ResponseEntity<SubscriberStats> stats(@PathVariable String email) {
        return ResponseEntity.ok(subscriptionService.stats(email));
    }
}
