package ru.mirror.relay.controller;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import ru.mirror.relay.model.UrlFilter;

import java.util.List;
import java.util.stream.Stream;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FilterControllerTest extends ManagementTest {

    @Test
    void getAllFiltersInSortOrder() throws Exception {
        long second = createFilterInDB("b", "c", 2);
        long first = createFilterInDB("a", "b", 1);
        long third = createFilterInDB("amzn\\.to/\\w+", "amz", 3);

        this.mockMvc.perform(get("/filter/findAll").with(admin()))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].id").value(first))
                .andExpect(jsonPath("$[1].id").value(second))
                .andExpect(jsonPath("$[2].id").value(third))
                .andExpect(jsonPath("$[2].replacement").value("amz"));
    }

    @Test
    void saveAppendsToTheEnd() throws Exception {
        Stream.of(new UrlFilter(null, "foo", "bar", 0), new UrlFilter(null, "ref=\\w+", "", 0))
                .forEach(filter -> {
                    try {
                        this.mockMvc.perform(post("/filter/save").with(admin())
                                        .contentType(MediaType.APPLICATION_JSON)
                                        .content(toJson(filter)))
                                .andDo(print())
                                .andExpect(status().isCreated())
                                .andExpect(jsonPath("$.id").isNumber())
                                .andExpect(jsonPath("$.pattern").value(filter.getPattern()));
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                });

        List<UrlFilter> filters = getFiltersFromDB();
        assertEquals(2, filters.size());
        assertEquals("foo", filters.get(0).getPattern());
        assertEquals(1, filters.get(0).getSortOrder());
        assertEquals("ref=\\w+", filters.get(1).getPattern());
        assertEquals(2, filters.get(1).getSortOrder());
    }

    @Test
    void saveWithoutReplacementUsesEmptyString() throws Exception {
        this.mockMvc.perform(post("/filter/save").with(admin())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pattern\":\"utm_\\\\w+\"}"))
                .andDo(print())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.replacement").value(""));

        assertEquals("", getFiltersFromDB().get(0).getReplacement());
    }

    @Test
    void updateFilter() throws Exception {
        long id = createFilterInDB("a", "b", 1);

        this.mockMvc.perform(put("/filter/update/" + id).with(admin())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(new UrlFilter(null, "x+", "y", 0))))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pattern").value("x+"))
                .andExpect(jsonPath("$.sortOrder").value(1));

        UrlFilter filter = getFiltersFromDB().get(0);
        assertEquals("x+", filter.getPattern());
        assertEquals("y", filter.getReplacement());
        assertEquals(1, filter.getSortOrder());
    }

    @Test
    void updateUnknownFilter() throws Exception {
        this.mockMvc.perform(put("/filter/update/404").with(admin())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(new UrlFilter(null, "x", "y", 0))))
                .andDo(print())
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteFilterById() throws Exception {
        long removed = createFilterInDB("a", "b", 1);
        long kept = createFilterInDB("b", "c", 2);

        this.mockMvc.perform(delete("/filter/delete/" + removed).with(admin()))
                .andDo(print())
                .andExpect(status().isOk());

        List<UrlFilter> filters = getFiltersFromDB();
        assertEquals(1, filters.size());
        assertEquals(kept, filters.get(0).getId());
    }

    @Test
    void deleteUnknownFilter() throws Exception {
        this.mockMvc.perform(delete("/filter/delete/404").with(admin()))
                .andDo(print())
                .andExpect(status().isNotFound());
    }

    @Test
    void moveUpSwapsWithPrevious() throws Exception {
        long first = createFilterInDB("a", "1", 1);
        long second = createFilterInDB("b", "2", 2);
        long third = createFilterInDB("c", "3", 3);

        this.mockMvc.perform(post("/filter/moveUp/" + third).with(admin()))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(first))
                .andExpect(jsonPath("$[1].id").value(third))
                .andExpect(jsonPath("$[2].id").value(second));

        assertEquals(List.of(first, third, second), getFiltersFromDB().stream().map(UrlFilter::getId).toList());
    }

    @Test
    void moveUpFirstKeepsOrder() throws Exception {
        long first = createFilterInDB("a", "1", 1);
        long second = createFilterInDB("b", "2", 2);

        this.mockMvc.perform(post("/filter/moveUp/" + first).with(admin()))
                .andDo(print())
                .andExpect(status().isOk());

        assertEquals(List.of(first, second), getFiltersFromDB().stream().map(UrlFilter::getId).toList());
    }

    @Test
    void moveDownLastKeepsOrder() throws Exception {
        long first = createFilterInDB("a", "1", 1);
        long second = createFilterInDB("b", "2", 2);

        this.mockMvc.perform(post("/filter/moveDown/" + second).with(admin()))
                .andDo(print())
                .andExpect(status().isOk());

        assertEquals(List.of(first, second), getFiltersFromDB().stream().map(UrlFilter::getId).toList());
    }

    @Test
    void moveDownWithEqualSortOrders() throws Exception {
        long first = createFilterInDB("a", "1", 0);
        long second = createFilterInDB("b", "2", 0);
        long third = createFilterInDB("c", "3", 0);

        this.mockMvc.perform(post("/filter/moveDown/" + first).with(admin()))
                .andDo(print())
                .andExpect(status().isOk());

        List<UrlFilter> filters = getFiltersFromDB();
        assertEquals(List.of(second, first, third), filters.stream().map(UrlFilter::getId).toList());
        assertTrue(filters.get(0).getSortOrder() < filters.get(1).getSortOrder());
        assertTrue(filters.get(1).getSortOrder() < filters.get(2).getSortOrder());
    }

    @Test
    void moveUnknownFilter() throws Exception {
        this.mockMvc.perform(post("/filter/moveDown/404").with(admin()))
                .andDo(print())
                .andExpect(status().isNotFound());
    }

    @Test
    void findAllRequiresAuthentication() throws Exception {
        this.mockMvc.perform(get("/filter/findAll"))
                .andDo(print())
                .andExpect(status().isUnauthorized());
    }

    @Test
    void wrongPasswordIsRejected() throws Exception {
        this.mockMvc.perform(get("/filter/findAll")
                        .with(httpBasic(ADMIN_USER, "wrong")))
                .andDo(print())
                .andExpect(status().isUnauthorized());
    }
}
