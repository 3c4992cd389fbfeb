package io.harvest.supervisor;

@FunctionalInterface
public interface LineClassifier {
    LivenessEvent classify(String line);
}
