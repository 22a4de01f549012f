package de.jwiegmann.meetinglog.boundary.dto.session;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotNull
    private String department;

    @NotNull
    private String group;

    @NotNull
    @ToString.Exclude
    private String password;
}
