package com.example.automatacurve;

import java.util.List;

/**
 * A long-running step function. Implementations poll the token between
 * units of work and return what they have when it is set.
 */
@FunctionalInterface
public interface CurveTask {
    List<PointSet> compute(CancellationToken token);
}
