package com.deepansh.memorychat.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant
    }

    @NotNull(message = "role is required")
    private Role role;
    private String content;

    public static Message system(String content) {
        return new Message(Role.system, content);
    }

    public static Message user(String content) {
        return new Message(Role.user, content);
    }

    public static Message assistant(String content) {
        return new Message(Role.assistant, content);
    }
}
