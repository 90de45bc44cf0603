package org.brown.coderunner.exception;

import org.brown.coderunner.model.ErrorKind;

/**
 * 런타임 이미지 pull 실패. 같은 pull 을 기다리던 모든 호출자에게 전달된다.
 */
public class ImageUnavailableException extends SandboxException {

    public ImageUnavailableException(String message) {
        super(ErrorKind.IMAGE_UNAVAILABLE, message);
    }

    public ImageUnavailableException(String message, Throwable cause) {
        super(ErrorKind.IMAGE_UNAVAILABLE, message, cause);
    }
}
