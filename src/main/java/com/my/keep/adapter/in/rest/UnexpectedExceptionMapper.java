package com.my.keep.adapter.in.rest;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * 왜: 도메인 밖에서 새어 나온 예외도 {"error": 메시지} 형태로 응답하기 위함.
 * <p>
 * 게이트웨이 예외는 더 구체적인 {@link KeepExceptionMapper} 가 처리하고, JAX-RS 자체 응답(404 등)은 그대로 둔다.
 */
@Provider
public class UnexpectedExceptionMapper implements ExceptionMapper<RuntimeException> {

    private static final Logger log = Logger.getLogger(UnexpectedExceptionMapper.class);

    @Override
    public Response toResponse(RuntimeException exception) {
        if (exception instanceof WebApplicationException webApplicationException) {
            return webApplicationException.getResponse();
        }
        log.errorf(exception, "예상하지 못한 오류 [%s]", exception.getClass().getSimpleName());
        String message = exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
        return Response.serverError()
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(message))
                .build();
    }
}
