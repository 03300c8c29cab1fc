package com.park.lot.api;

import com.park.common.model.WhitelistView;
import com.park.lot.exception.DuplicatePlateException;
import com.park.lot.service.LotQueryService;
import com.park.lot.service.WhitelistRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WhitelistController.class)
class WhitelistControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private WhitelistRegistry registry;

    @MockBean
    private LotQueryService queryService;

    @Test
    void listNewestFirst() throws Exception {
        when(queryService.whitelist()).thenReturn(List.of(
                WhitelistView.builder().id(2L).plateNumber("京A00001").notes("agency")
                        .createdAt(Instant.parse("2026-02-28T06:00:00Z")).build(),
                WhitelistView.builder().id(1L).plateNumber("粤B88888").notes("VIP")
                        .createdAt(Instant.parse("2026-02-27T06:00:00Z")).build()));

        mvc.perform(get("/api/whitelist"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].plateNumber").value("京A00001"))
                .andExpect(jsonPath("$[1].plateNumber").value("粤B88888"));
    }

    @Test
    void duplicateAddIsAConflict() throws Exception {
        when(registry.add("粤B88888", "again")).thenThrow(new DuplicatePlateException("粤B88888"));

        mvc.perform(post("/api/whitelist").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plateNumber\":\"粤B88888\",\"notes\":\"again\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE_PLATE"));
    }

    @Test
    void removeAlwaysSucceeds() throws Exception {
        mvc.perform(delete("/api/whitelist/{plate}", "沪C66666"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        mvc.perform(delete("/api/whitelist/{plate}", "沪C66666"))
                .andExpect(status().isOk());

        verify(registry, times(2)).remove("沪C66666");
    }
}
