package com.phillippitts.platemate.domain;

/** Author of a chat message. */
public enum Sender { USER, ASSISTANT }
