package io.firefeed.pipeline.api;

import io.firefeed.pipeline.api.dto.ValidationResult;
import io.firefeed.pipeline.api.exception.ErrorCategory;
import io.firefeed.pipeline.api.service.feed.FeedValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class FeedControllerTest {

    @Mock
    private FeedValidator feedValidator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new FeedController(feedValidator)).build();
    }

    @Test
    void shouldValidateFeed() throws Exception {
        when(feedValidator.validate("https://feeds.bbci.co.uk/news/world/rss.xml"))
                .thenReturn(ValidationResult.valid(25));

        mockMvc.perform(get("/api/v1/feeds/validate").param("url", "https://feeds.bbci.co.uk/news/world/rss.xml"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.entryCount").value(25));
    }

    @Test
    void shouldReportInvalidFeed() throws Exception {
        when(feedValidator.validate("https://example.com/missing.xml"))
                .thenReturn(ValidationResult.invalid("HTTP 404", ErrorCategory.NOT_FOUND));

        mockMvc.perform(get("/api/v1/feeds/validate").param("url", "https://example.com/missing.xml"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.category").value("NOT_FOUND"));
    }

    @Test
    void shouldRejectBlankUrl() throws Exception {
        mockMvc.perform(get("/api/v1/feeds/validate").param("url", " "))
                .andExpect(status().isBadRequest());

        verify(feedValidator, never()).validate(anyString());
    }
}
