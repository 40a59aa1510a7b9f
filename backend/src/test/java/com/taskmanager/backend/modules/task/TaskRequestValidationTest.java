package com.taskmanager.backend.modules.task;

import static org.assertj.core.api.Assertions.assertThat;

import com.taskmanager.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskmanager.backend.modules.task.presentation.dto.UpdateTaskRequest;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TaskRequestValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeFactory() {
        factory.close();
    }

    @Test
    void multiLineTitleAcceptedOnCreateIsAcceptedOnUpdate() {
        String title = "Groceries\nmilk";

        assertThat(validator.validate(new CreateTaskRequest(title, null, null, null))).isEmpty();
        assertThat(validator.validate(new UpdateTaskRequest(title, null, null, null))).isEmpty();
    }

    @Test
    void absentTitleIsAllowedOnUpdate() {
        assertThat(validator.validate(new UpdateTaskRequest(null, null, null, 3))).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\n\t"})
    void blankTitleIsRejectedOnBothRequests(String title) {
        assertThat(validator.validate(new CreateTaskRequest(title, null, null, null))).hasSize(1);
        assertThat(validator.validate(new UpdateTaskRequest(title, null, null, null))).hasSize(1);
    }
}
