package com.dailycode.application.subscription;

import com.dailycode.domain.subscriber.model.Subscriber;

/**
 * @param reactivated true when an inactive identity was brought back instead of registered
 */
public record SubscriptionResult(Subscriber subscriber, boolean reactivated) {}
