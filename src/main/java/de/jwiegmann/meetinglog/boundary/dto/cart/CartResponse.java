package de.jwiegmann.meetinglog.boundary.dto.cart;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {
    private String sessionId;
    private int size;
    private List<CartItemResponse> items;
}
