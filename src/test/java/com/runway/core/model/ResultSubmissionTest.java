package com.runway.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultSubmissionTest {

    @Test
    @DisplayName("exit code 0 maps to ok without a message")
    void success() {
        var submission = ResultSubmission.from(new CommandResult("out", "", 0, 12));

        assertEquals(ResultStatus.OK, submission.status());
        assertEquals("out", submission.stdout());
        assertEquals(0, submission.exitCode());
        assertEquals(12, submission.duration());
        assertNull(submission.message());
    }

    @Test
    @DisplayName("nonzero exit code maps to error with the first stderr line")
    void failure() {
        var submission = ResultSubmission.from(new CommandResult("", "boom\nstack", 2, 5));

        assertEquals(ResultStatus.ERROR, submission.status());
        assertEquals(2, submission.exitCode());
        assertEquals("Command failed with exit code 2: boom", submission.message());
    }

    @Test
    @DisplayName("failure without stderr still carries a message")
    void failureWithoutStderr() {
        var submission = ResultSubmission.from(new CommandResult("", "", 127, 0));
        assertEquals("Command failed with exit code 127", submission.message());
    }
}
