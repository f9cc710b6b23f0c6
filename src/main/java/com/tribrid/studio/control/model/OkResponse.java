package com.tribrid.studio.control.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code {ok: bool}} acknowledgement returned by cancel and promote.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OkResponse {

    private boolean ok;

    private String error;

    public static OkResponse accepted() {
        return new OkResponse(true, null);
    }

    public static OkResponse rejected(String error) {
        return new OkResponse(false, error);
    }
}
