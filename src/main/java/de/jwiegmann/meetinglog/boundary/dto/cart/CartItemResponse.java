package de.jwiegmann.meetinglog.boundary.dto.cart;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResponse {
    private int position;
    private String content;
    private String attachmentName; // null = kein Anhang
}
