package com.gt.lss.exception;

// Thrown when the backing store cannot serve a scheduling request
public class DaoException extends RuntimeException {

    public DaoException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
