package analysis;

import engine.ErrorKind;

import java.util.List;

/**
 * One documented input with its expected outcome: either the final common prefix or, for
 * rejected input, the error kind.
 */
public record UsageExample(String name,
                           String description,
                           String useCase,
                           List<String> input,
                           String expectedFinalPrefix,
                           ErrorKind expectedError) {

    public UsageExample {
        input = List.copyOf(input);
        if ((expectedFinalPrefix == null) == (expectedError == null)) {
            throw new IllegalArgumentException("exactly one of expectedFinalPrefix and expectedError must be set");
        }
    }

    public boolean expectsError() {
        return expectedError != null;
    }
}
