package com.movesim.api.controller;

import com.movesim.api.dto.response.UserLocationResponse;
import com.movesim.domain.model.Sample;
import com.movesim.exception.NoSamplesInRangeException;
import com.movesim.exception.ValidationException;
import com.movesim.mapper.LocationMapper;
import com.movesim.timeseries.SampleRetriever;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for recorded movement history.
 *
 * <p>{@code GET /user/{userId}?min=0.2&max=0.5} returns the slice of the user's samples between
 * the 20% and 50% marks of their sorted history. Both bounds are optional (defaults 0.0 and 1.0)
 * and must satisfy {@code 0 <= min <= max <= 1}. An empty slice is a 404, a store failure a 503,
 * and a request without a user id ({@code GET /user/}) a 400.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class LocationController {

    private final SampleRetriever sampleRetriever;
    private final LocationMapper locationMapper;

    @GetMapping("/user/{userId}")
    public ResponseEntity<UserLocationResponse> getUserLocations(
            @PathVariable String userId,
            @RequestParam(name = "min", defaultValue = "0.0") double minFraction,
            @RequestParam(name = "max", defaultValue = "1.0") double maxFraction) {

        validateFraction("min", minFraction);
        validateFraction("max", maxFraction);
        if (minFraction > maxFraction) {
            throw new ValidationException(
                    "'min' parameter cannot be greater than 'max' parameter",
                    Map.of("min", minFraction, "max", maxFraction));
        }

        log.info("GET /user/{} request with min={}, max={}", userId, minFraction, maxFraction);

        List<Sample> samples = sampleRetriever.fetch(userId, minFraction, maxFraction);
        if (samples.isEmpty()) {
            throw new NoSamplesInRangeException(userId);
        }

        return ResponseEntity.ok(UserLocationResponse.builder()
                .userId(userId)
                .data(locationMapper.toResponseList(samples))
                .build());
    }

    @GetMapping({"/user", "/user/"})
    public ResponseEntity<UserLocationResponse> getWithoutUserId() {
        throw new ValidationException("Invalid URL path. Expected /user/{user_id}");
    }

    private static void validateFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(
                    "Invalid '" + name + "' parameter. Must be a float between 0.0 and 1.0.");
        }
    }
}
