package com.boxoffice.service;

import com.boxoffice.engine.Limits;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of an init request. Fields the client leaves out stay invalid, so
 * initialization fails unless every limit is supplied.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InitPayload {
    @JsonProperty("MaxExchanges")
    private int maxExchanges = -1;

    @JsonProperty("MaxMovies")
    private int maxMovies = -1;

    @JsonProperty("MaxShowings")
    private int maxShowings = -1;

    @JsonProperty("MaxSeats")
    private int maxSeats = -1;

    @JsonProperty("MaxWindows")
    private int maxWindows = -1;

    /**
     * Converts the payload into engine limits.
     *
     * @return The requested limits, not yet validated.
     */
    public Limits toLimits() {
        return new Limits(this.maxExchanges, this.maxMovies, this.maxShowings, this.maxSeats, this.maxWindows);
    }
}
