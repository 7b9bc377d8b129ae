package org.panchanga.testutil;

import org.panchanga.astronomy.CelestialModel;
import org.panchanga.astronomy.TruncatedSeriesCelestialModel;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegating celestial model that counts every position request.
 */
public final class CountingCelestialModel implements CelestialModel {
    private final CelestialModel delegate;
    private final AtomicInteger calls = new AtomicInteger();

    public CountingCelestialModel() {
        this(TruncatedSeriesCelestialModel.instance());
    }

    public CountingCelestialModel(CelestialModel delegate) {
        this.delegate = delegate;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public String id() {
        return "COUNTING(" + delegate.id() + ")";
    }

    @Override
    public double solarLongitude(double julianInstant) {
        calls.incrementAndGet();
        return delegate.solarLongitude(julianInstant);
    }

    @Override
    public double lunarLongitude(double julianInstant) {
        calls.incrementAndGet();
        return delegate.lunarLongitude(julianInstant);
    }

    @Override
    public double lunarLatitude(double julianInstant) {
        calls.incrementAndGet();
        return delegate.lunarLatitude(julianInstant);
    }

    @Override
    public double ayanamsa(double julianInstant) {
        calls.incrementAndGet();
        return delegate.ayanamsa(julianInstant);
    }

    @Override
    public double obliquity(double julianInstant) {
        calls.incrementAndGet();
        return delegate.obliquity(julianInstant);
    }
}
