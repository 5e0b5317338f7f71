package com.my.keep.adapter.in.rest;

import com.my.keep.domain.model.WireNote;
import com.my.keep.domain.port.in.ListNotesUseCase;
import com.my.keep.domain.port.in.SyncNotesUseCase;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

/**
 * 왜: 프론트엔드가 사용하는 노트 조회/수동 동기화 엔드포인트를 도메인 유스케이스로 연결하기 위함.
 */
@Path("/api/notes")
@Produces(MediaType.APPLICATION_JSON)
public class NotesResource {

    private final ListNotesUseCase listNotesUseCase;
    private final SyncNotesUseCase syncNotesUseCase;

    @Inject
    public NotesResource(ListNotesUseCase listNotesUseCase, SyncNotesUseCase syncNotesUseCase) {
        this.listNotesUseCase = listNotesUseCase;
        this.syncNotesUseCase = syncNotesUseCase;
    }

    @GET
    public NotesResponse list(@QueryParam("sync") @DefaultValue("false") boolean sync,
                              @QueryParam("trashed") @DefaultValue("false") boolean trashed,
                              @QueryParam("archived") @DefaultValue("false") boolean archived) {
        return new NotesResponse(listNotesUseCase.listNotes(sync, trashed, archived));
    }

    @POST
    @Path("/sync")
    public StatusResponse sync() {
        syncNotesUseCase.forceSync();
        return new StatusResponse("synced");
    }

    public record NotesResponse(List<WireNote> notes) {
    }
}
