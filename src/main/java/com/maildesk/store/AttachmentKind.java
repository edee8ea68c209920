package com.maildesk.store;

public enum AttachmentKind {
    FILE,
    BODY
}
