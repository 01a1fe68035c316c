package com.robobracket.web;

import com.robobracket.engine.AlreadyCompletedException;
import com.robobracket.engine.CycleDetectedException;
import com.robobracket.engine.GameNotFoundException;
import com.robobracket.engine.GameNotReadyException;
import com.robobracket.engine.InvalidEntryException;
import com.robobracket.engine.InvalidWinnerException;
import com.robobracket.engine.UnsupportedSizeException;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BracketEngineExceptionHandlerTest {

    private final BracketEngineExceptionHandler handler = new BracketEngineExceptionHandler();

    @Test
    void mapsEngineErrorsToHttpStatuses() {
        assertEquals(HttpStatus.NOT_FOUND, BracketEngineExceptionHandler.statusFor(new GameNotFoundException(3)));
        assertEquals(HttpStatus.CONFLICT, BracketEngineExceptionHandler.statusFor(new AlreadyCompletedException("done")));
        assertEquals(HttpStatus.CONFLICT, BracketEngineExceptionHandler.statusFor(new GameNotReadyException(4)));
        assertEquals(
                HttpStatus.INTERNAL_SERVER_ERROR,
                BracketEngineExceptionHandler.statusFor(new CycleDetectedException("loop"))
        );
        assertEquals(HttpStatus.BAD_REQUEST, BracketEngineExceptionHandler.statusFor(UnsupportedSizeException.forSize(6)));
        assertEquals(HttpStatus.BAD_REQUEST, BracketEngineExceptionHandler.statusFor(new InvalidEntryException("dup")));
        assertEquals(HttpStatus.BAD_REQUEST, BracketEngineExceptionHandler.statusFor(new InvalidWinnerException("who")));
    }

    @Test
    void engineErrorBodyCarriesCodeAndMessage() {
        ResponseEntity<BracketEngineExceptionHandler.BracketEngineErrorResponse> response =
                handler.handle(new GameNotReadyException(9));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("game_not_ready", response.getBody().code());
        assertEquals("Bracket game 9 does not have both teams yet", response.getBody().message());
    }

    @Test
    void validationBodyKeepsFirstMessagePerFieldAndObjectLevelErrors() throws Exception {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new Object(), "recordResultRequest");
        bindingResult.addError(new FieldError("recordResultRequest", "winnerId", "winnerId is required"));
        bindingResult.addError(new FieldError("recordResultRequest", "winnerId", "winnerId must be positive"));
        bindingResult.addError(new ObjectError("recordResultRequest", "teams must differ"));
        MethodParameter parameter = new MethodParameter(
                BracketEngineExceptionHandlerTest.class.getDeclaredMethod("requestSink", Object.class),
                0
        );

        ResponseEntity<BracketEngineExceptionHandler.ValidationErrorResponse> response =
                handler.handleInvalidRequest(new MethodArgumentNotValidException(parameter, bindingResult));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(
                Map.of("winnerId", "winnerId is required", "recordResultRequest", "teams must differ"),
                response.getBody().fieldErrors()
        );
        assertEquals(
                "Validation failed: winnerId is required; teams must differ",
                response.getBody().detail()
        );
    }

    @SuppressWarnings("unused")
    private void requestSink(Object request) {
    }
}
