package com.cred.freestyle.catalog.api.controller;

import com.cred.freestyle.catalog.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.catalog.config.SecurityConfig;
import com.cred.freestyle.catalog.service.OwnerDirectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for OwnerAdminController using MockMvc.
 */
@WebMvcTest(OwnerAdminController.class)
@ContextConfiguration(classes = {OwnerAdminController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("OwnerAdminController Tests")
class OwnerAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OwnerDirectory ownerDirectory;

    @Test
    @DisplayName("POST /{ownerId}/deactivate - Admin deactivates an owner")
    void deactivate_Admin_Returns204() throws Exception {
        mockMvc.perform(post("/api/v1/admin/owners/{ownerId}/deactivate", "owner-1")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isNoContent());

        verify(ownerDirectory).deactivate("owner-1", "admin-1");
    }

    @Test
    @DisplayName("POST /{ownerId}/deactivate - Regular user is rejected")
    void deactivate_User_Returns403() throws Exception {
        mockMvc.perform(post("/api/v1/admin/owners/{ownerId}/deactivate", "owner-1")
                        .header("X-User-Id", "owner-1"))
                .andExpect(status().isForbidden());

        verify(ownerDirectory, never()).deactivate(anyString(), anyString());
    }

    @Test
    @DisplayName("POST /{ownerId}/reactivate - Admin reactivates an owner")
    void reactivate_Admin_Returns204() throws Exception {
        mockMvc.perform(post("/api/v1/admin/owners/{ownerId}/reactivate", "owner-1")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isNoContent());

        verify(ownerDirectory).reactivate("owner-1");
    }
}
