package com.retailpos.pricing.controller;

import com.retailpos.pricing.dto.Bill;
import com.retailpos.pricing.dto.LineItem;
import com.retailpos.pricing.dto.LineRequest;
import com.retailpos.pricing.exception.StoreUnavailableException;
import com.retailpos.pricing.exception.UnresolvedProductException;
import com.retailpos.pricing.service.BillingService;
import com.retailpos.pricing.service.IdentityResolver;
import com.retailpos.pricing.service.PricingEngine;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BillingController.class)
class BillingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PricingEngine pricingEngine;
    @MockBean
    private BillingService billingService;
    @MockBean
    private IdentityResolver identityResolver;

    private static LineItem riceLine(String qty, String amount) {
        return new LineItem(1L, null, "Basmati Rice", "RICE01", "kilogram", new BigDecimal(qty),
                new BigDecimal("110"), new BigDecimal("120"), BigDecimal.ONE, new BigDecimal(amount),
                BigDecimal.ZERO, new BigDecimal(amount), null, BigDecimal.ZERO);
    }

    @Test
    void priceLine_ShouldReturnPricedLine() throws Exception {
        when(pricingEngine.priceLine("RICE01", new BigDecimal("2"), "kg", null))
                .thenReturn(riceLine("2", "220.00"));

        mockMvc.perform(post("/api/billing/line")
                        .param("token", "RICE01")
                        .param("quantity", "2")
                        .param("uom", "kg"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Basmati Rice"))
                .andExpect(jsonPath("$.lineAmount").value(220.0));
    }

    @Test
    void priceLine_MalformedQuantity_ShouldPriceAsZero() throws Exception {
        when(pricingEngine.priceLine(eq("RICE01"), any(), isNull(), isNull()))
                .thenReturn(riceLine("0", "0.00"));

        mockMvc.perform(post("/api/billing/line")
                        .param("token", "RICE01")
                        .param("quantity", "two"))
                .andExpect(status().isOk());

        verify(pricingEngine).priceLine("RICE01", BigDecimal.ZERO, null, null);
    }

    @Test
    void priceLine_UnknownToken_ShouldReturnNotFound() throws Exception {
        when(pricingEngine.priceLine(eq("NOPE"), any(), any(), any()))
                .thenThrow(new UnresolvedProductException("NOPE"));

        mockMvc.perform(post("/api/billing/line").param("token", "NOPE").param("quantity", "1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.message").value("No product or alias matches 'NOPE'"))
                .andExpect(jsonPath("$.path").value("/api/billing/line"));
    }

    @Test
    void lookup_StoreDown_ShouldReturnServiceUnavailable() throws Exception {
        when(billingService.lookup("RICE01"))
                .thenThrow(new StoreUnavailableException("Catalog store unavailable during barcode lookup", null));

        mockMvc.perform(get("/api/billing/lookup").param("token", "RICE01"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Service Unavailable"));
    }

    @SuppressWarnings("unchecked")
    @Test
    void priceBill_ShouldParseEveryCell() throws Exception {
        when(billingService.priceBill(anyList())).thenReturn(new Bill(List.of(riceLine("1.5", "165.00")),
                new BigDecimal("1.5"), new BigDecimal("165.00"), new BigDecimal("165")));

        mockMvc.perform(post("/api/billing/bill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"token\":\"RICE01\",\"quantity\":\"1.5\",\"uom\":\"kg\",\"mrp\":\"120\"},"
                                + "{\"token\":\"SOAP01\",\"quantity\":\"1,5\",\"uom\":null,\"mrp\":\"\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roundedTotal").value(165));

        ArgumentCaptor<List<LineRequest>> captor = ArgumentCaptor.forClass(List.class);
        verify(billingService).priceBill(captor.capture());
        List<LineRequest> requests = captor.getValue();
        assertEquals(2, requests.size());
        assertEquals(new BigDecimal("1.5"), requests.get(0).quantity());
        assertEquals(new BigDecimal("120"), requests.get(0).mrp());
        assertEquals(BigDecimal.ZERO, requests.get(1).quantity());
        assertNull(requests.get(1).mrp());
    }

    @Test
    void search_ShouldDelegateToResolver() throws Exception {
        when(identityResolver.search("rice")).thenReturn(List.of());

        mockMvc.perform(get("/api/billing/search").param("q", "rice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
