package org.moviegraph.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.moviegraph.models.enums.RunStatus;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "schema_build_run")
public class BuildRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "build_run_id", nullable = false)
    private Long id;

    @Column(name = "run_uid", nullable = false, length = 40, unique = true)
    private String runUid;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_status", nullable = false, length = 16)
    @ColumnDefault("'QUEUED'")
    private RunStatus runStatus;

    @ColumnDefault("0")
    @Column(name = "rows_in")
    private Integer rowsIn;

    @ColumnDefault("0")
    @Column(name = "rows_out")
    private Integer rowsOut;

    @ColumnDefault("0")
    @Column(name = "tables_written")
    private Integer tablesWritten;

    @Column(name = "error_code", length = 40)
    private String errorCode;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;
}
