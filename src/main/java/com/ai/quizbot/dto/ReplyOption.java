package com.ai.quizbot.dto;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One entry of an interactive control: an opaque id echoed back by the provider
 * and the title shown to the user.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(staticName = "of")
public class ReplyOption {

    private final String id;

    private final String title;
}
