package com.example.automatacurve;

import java.util.Collections;
import java.util.List;

/** Either a validated model or the complete list of problems that prevented it. */
public class BuildResult {

    private final TransducerModel model;
    private final List<String> errors;

    BuildResult(TransducerModel model, List<String> errors) {
        this.model = model;
        this.errors = Collections.unmodifiableList(errors);
    }

    /** @return the built model, or {@code null} when {@link #getErrors()} is not empty */
    public TransducerModel getModel() { return model; }

    public List<String> getErrors() { return errors; }

    public boolean isSuccess() { return model != null; }
}
