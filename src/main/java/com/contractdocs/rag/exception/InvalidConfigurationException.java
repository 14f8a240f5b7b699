package com.contractdocs.rag.exception;

import lombok.experimental.StandardException;

@StandardException
public class InvalidConfigurationException extends RuntimeException {
}
