package com.boxoffice.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.boxoffice.engine.TicketRequest;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of a sell request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SellPayload {
    /**
     * Pairs of movie and showing numbers.
     */
    @JsonProperty("TicketRequests")
    private List<int[]> ticketRequests = new ArrayList<>();

    /**
     * Reserved for future use, passed to the engine unchanged.
     */
    @JsonProperty("PaymentInfo")
    private Map<String, Object> paymentInfo = Map.of();

    /**
     * Copied as-is onto the receipt.
     */
    @JsonProperty("LocalTime")
    private Object localTime;

    /**
     * Converts the movie/showing pairs into ticket requests.
     *
     * @return The ticket requests in order.
     * @throws IllegalArgumentException If a pair does not have exactly two elements.
     */
    public List<TicketRequest> toTicketRequests() {
        final var requests = new ArrayList<TicketRequest>(this.ticketRequests.size());
        for (var i = 0; i < this.ticketRequests.size(); i++) {
            final var pair = this.ticketRequests.get(i);
            if (pair == null || pair.length != 2) {
                throw new IllegalArgumentException(
                        String.format("ticket request %d must be a [movie, showing] pair", i + 1));
            }
            requests.add(new TicketRequest(pair[0], pair[1]));
        }
        return requests;
    }

    public Map<String, Object> getPaymentInfo() {
        return this.paymentInfo == null ? Map.of() : this.paymentInfo;
    }

    public Object getLocalTime() {
        return this.localTime;
    }
}
