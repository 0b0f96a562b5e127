package com.example.messaging.shared.model;

import lombok.Value;

@Value
public class PollOption {
    String text;
    long tally;
}
