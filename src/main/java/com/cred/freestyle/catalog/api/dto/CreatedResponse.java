package com.cred.freestyle.catalog.api.dto;

/**
 * Response for a newly created aggregate. The aggregate only has a draft at this point.
 *
 * @author Catalog Team
 */
public class CreatedResponse {

    private Long id;

    public CreatedResponse() {
    }

    public CreatedResponse(Long id) {
        this.id = id;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }
}
