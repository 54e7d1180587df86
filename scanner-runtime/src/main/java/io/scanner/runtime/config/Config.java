package io.scanner.runtime.config;

import java.io.Serializable;

/** Basic config interface. */
public interface Config extends org.aeonbits.owner.Config, Serializable {}
