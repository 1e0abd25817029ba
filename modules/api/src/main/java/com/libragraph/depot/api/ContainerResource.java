package com.libragraph.depot.api;

import com.libragraph.depot.core.bundle.BundleSink;
import com.libragraph.depot.core.bundle.Download;
import com.libragraph.depot.core.bundle.DownloadService;
import com.libragraph.depot.core.container.ContainerIndex;
import com.libragraph.depot.core.container.LineageService;
import com.libragraph.depot.core.model.FileVersion;
import com.libragraph.depot.core.model.UploadRequest;
import com.libragraph.depot.core.store.StorageUnavailableException;
import com.libragraph.depot.core.version.CountResult;
import com.libragraph.depot.core.version.DeleteResult;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.StreamingOutput;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Containers, files and versions over HTTP. Ids are 16-digit hex strings;
 * {@code where} parameters are JSON where documents.
 */
@Path("/api/containers")
@Produces(MediaType.APPLICATION_JSON)
public class ContainerResource {

    public static final String METADATA_HEADER = "X-Depot-Metadata";

    /** Body of a rename request. */
    public record RenameRequest(String name) {}

    @Inject
    ContainerIndex containers;

    @Inject
    LineageService lineage;

    @Inject
    DownloadService downloads;

    @Inject
    RequestJson json;

    // -- containers --

    @GET
    public List<String> listContainers() {
        return containers.listContainers().await().indefinitely();
    }

    @POST
    @Path("/{container}/rename")
    @Consumes(MediaType.APPLICATION_JSON)
    public CountResult renameContainer(@PathParam("container") String container, RenameRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Rename needs a non-blank 'name'");
        }
        return containers.renameContainer(container, request.name()).await().indefinitely();
    }

    @DELETE
    @Path("/{container}")
    public DeleteResult deleteContainer(@PathParam("container") String container) {
        return containers.deleteContainer(container).await().indefinitely();
    }

    @GET
    @Path("/{container}/files")
    public List<VersionView> listFiles(@PathParam("container") String container,
                                       @QueryParam("where") String where) {
        return VersionView.of(containers.listCurrentFiles(container, json.where(where)).await().indefinitely());
    }

    @GET
    @Path("/{container}/files/count")
    public CountResult countFiles(@PathParam("container") String container,
                                  @QueryParam("where") String where) {
        return containers.countCurrentFiles(container, json.where(where)).await().indefinitely();
    }

    @GET
    @Path("/{container}/download")
    @Produces(MediaType.WILDCARD)
    public Response downloadContainer(@PathParam("container") String container,
                                      @QueryParam("where") String where) {
        return stream(downloads.container(container, json.where(where)).await().indefinitely());
    }

    @GET
    @Path("/{container}/download/first")
    @Produces(MediaType.WILDCARD)
    public Response downloadFirstMatch(@PathParam("container") String container,
                                       @QueryParam("where") String where,
                                       @QueryParam("alias") String alias,
                                       @QueryParam("inline") @DefaultValue("false") boolean inline) {
        return stream(downloads.firstMatch(container, json.where(where), alias, inline).await().indefinitely());
    }

    // -- files --

    /**
     * Stores the request body as a new version of {@code file}. With
     * {@code replace=true}, older versions of the file are deleted afterwards.
     */
    @PUT
    @Path("/{container}/files/{file}")
    @Consumes(MediaType.WILDCARD)
    public Response upload(@PathParam("container") String container,
                           @PathParam("file") String file,
                           @QueryParam("replace") @DefaultValue("false") boolean replace,
                           @HeaderParam(HttpHeaders.CONTENT_TYPE) String contentType,
                           @HeaderParam(METADATA_HEADER) String metadata,
                           InputStream body) {
        UploadRequest request = new UploadRequest(file, contentType, json.metadata(metadata), body);
        List<FileVersion> created = (replace
                ? lineage.replace(container, List.of(request))
                : lineage.upload(container, List.of(request)))
                .await().indefinitely();
        return Response.status(Response.Status.CREATED).entity(VersionView.of(created.get(0))).build();
    }

    /**
     * Stores each {@code file} part of a multipart form as a new version, in part
     * order. The optional {@code metadata} field is a JSON object applied to every
     * part. With {@code replace=true}, older versions of each file are deleted afterwards.
     */
    @POST
    @Path("/{container}/files")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    public Response uploadForm(@PathParam("container") String container,
                               @QueryParam("replace") @DefaultValue("false") boolean replace,
                               @RestForm("file") List<FileUpload> files,
                               @RestForm("metadata") String metadata) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("Upload needs at least one 'file' part");
        }
        Map<String, Object> custom = json.metadata(metadata);
        List<UploadRequest> requests = new ArrayList<>(files.size());
        for (FileUpload part : files) {
            requests.add(new UploadRequest(part.fileName(), part.contentType(), custom, open(part)));
        }
        List<FileVersion> created = (replace
                ? lineage.replace(container, requests)
                : lineage.upload(container, requests))
                .await().indefinitely();
        return Response.status(Response.Status.CREATED).entity(VersionView.of(created)).build();
    }

    private static InputStream open(FileUpload part) {
        try {
            return Files.newInputStream(part.uploadedFile());
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read uploaded part " + part.fileName(), e);
        }
    }

    @GET
    @Path("/{container}/files/{file}")
    public VersionView currentFile(@PathParam("container") String container, @PathParam("file") String file) {
        return VersionView.of(lineage.currentFile(container, file).await().indefinitely());
    }

    @DELETE
    @Path("/{container}/files/{file}")
    public DeleteResult deleteFile(@PathParam("container") String container, @PathParam("file") String file) {
        return lineage.deleteFile(container, file).await().indefinitely();
    }

    @GET
    @Path("/{container}/files/{file}/download")
    @Produces(MediaType.WILDCARD)
    public Response downloadFile(@PathParam("container") String container,
                                 @PathParam("file") String file,
                                 @QueryParam("alias") String alias,
                                 @QueryParam("inline") @DefaultValue("false") boolean inline) {
        return stream(downloads.file(container, file, alias, inline).await().indefinitely());
    }

    // -- versions --

    @GET
    @Path("/{container}/files/{file}/versions")
    public List<VersionView> listVersions(@PathParam("container") String container,
                                          @PathParam("file") String file,
                                          @QueryParam("where") String where) {
        return VersionView.of(lineage.versions(container, file, json.where(where)).await().indefinitely());
    }

    @GET
    @Path("/{container}/files/{file}/versions/count")
    public CountResult countVersions(@PathParam("container") String container,
                                     @PathParam("file") String file,
                                     @QueryParam("where") String where) {
        return lineage.countVersions(container, file, json.where(where)).await().indefinitely();
    }

    @GET
    @Path("/{container}/files/{file}/versions/download")
    @Produces(MediaType.WILDCARD)
    public Response downloadVersions(@PathParam("container") String container,
                                     @PathParam("file") String file,
                                     @QueryParam("alias") String alias,
                                     @QueryParam("where") String where) {
        return stream(downloads.versions(container, file, alias, json.where(where)).await().indefinitely());
    }

    @GET
    @Path("/{container}/files/{file}/versions/{version}")
    public VersionView version(@PathParam("container") String container,
                               @PathParam("file") String file,
                               @PathParam("version") String version) {
        return VersionView.of(lineage.version(container, file, version).await().indefinitely());
    }

    @PATCH
    @Path("/{container}/files/{file}/versions/{version}")
    @Consumes(MediaType.APPLICATION_JSON)
    public VersionView updateVersion(@PathParam("container") String container,
                                     @PathParam("file") String file,
                                     @PathParam("version") String version,
                                     Map<String, Object> metadata) {
        return VersionView.of(lineage.updateVersion(container, file, version, metadata).await().indefinitely());
    }

    @DELETE
    @Path("/{container}/files/{file}/versions/{version}")
    public DeleteResult deleteVersion(@PathParam("container") String container,
                                      @PathParam("file") String file,
                                      @PathParam("version") String version) {
        return lineage.deleteVersion(container, file, version).await().indefinitely();
    }

    @GET
    @Path("/{container}/files/{file}/versions/{version}/download")
    @Produces(MediaType.WILDCARD)
    public Response downloadVersion(@PathParam("container") String container,
                                    @PathParam("file") String file,
                                    @PathParam("version") String version,
                                    @QueryParam("alias") String alias,
                                    @QueryParam("inline") @DefaultValue("false") boolean inline) {
        return stream(downloads.version(container, file, version, alias, inline).await().indefinitely());
    }

    // -- internals --

    private static Response stream(Download download) {
        StreamingOutput body = out -> download.writeTo(BundleSink.of(out));
        return Response.ok(body, download.contentType())
                .header("Content-Disposition", contentDisposition(download))
                .build();
    }

    static String contentDisposition(Download download) {
        String name = download.name();
        String ascii = name.replaceAll("[^\\x20-\\x7e]", "_").replace("\\", "_").replace("\"", "_");
        String encoded = URLEncoder.encode(name, StandardCharsets.UTF_8).replace("+", "%20");
        return (download.inline() ? "inline" : "attachment")
                + "; filename=\"" + ascii + "\"; filename*=UTF-8''" + encoded;
    }
}
