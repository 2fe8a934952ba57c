package com.questrail.rotator.observability;

/**
 * No-op implementation of TranslatorObservabilitySink.
 */
public final class NullTranslatorObservabilitySink implements TranslatorObservabilitySink {
    public static final NullTranslatorObservabilitySink INSTANCE = new NullTranslatorObservabilitySink();

    private NullTranslatorObservabilitySink() {}

    @Override
    public void onSessionStateTransition(SessionStateTransitionEvent event) {}

    @Override
    public void onTraffic(TrafficEvent event) {}

    @Override
    public void onError(TranslatorErrorEvent event) {}
}
