package com.example.delivery.realtime;

/** A rendered frame and its target room, relayed between gateway instances. */
public record FanoutEnvelope(String room, String frame) {}
