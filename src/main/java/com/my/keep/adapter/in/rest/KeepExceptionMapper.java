package com.my.keep.adapter.in.rest;

import com.my.keep.domain.exception.KeepGatewayException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * 왜: 설정/인증/동기화/캐시 오류를 모두 {"error": 메시지} 와 500 상태로 통일해 프론트엔드가 재시도를 판단하도록 하기 위함.
 */
@Provider
public class KeepExceptionMapper implements ExceptionMapper<KeepGatewayException> {

    private static final Logger log = Logger.getLogger(KeepExceptionMapper.class);

    @Override
    public Response toResponse(KeepGatewayException exception) {
        log.errorf("요청 처리 실패 [%s]: %s", exception.getClass().getSimpleName(), exception.getMessage());
        return Response.serverError()
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(exception.getMessage()))
                .build();
    }
}
