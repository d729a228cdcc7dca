package com.aiprofessor.simulation.domain.port;

import com.aiprofessor.database.tenant.TenantConnection;
import com.aiprofessor.simulation.domain.PageResult;
import com.aiprofessor.simulation.domain.Paging;
import com.aiprofessor.simulation.domain.StudentRecord;
import java.util.Optional;

/** Students of one tenant database. E-mails are returned decrypted. */
public interface StudentDirectory {

    /** The student if it exists and is not soft-deleted, whatever its status. */
    Optional<StudentRecord> findActiveStudentById(TenantConnection connection, String studentId);

    /**
     * ACTIVE, non-deleted students matching {@code search} on first name, last name, student code
     * (case-insensitive) or exact e-mail, sorted by first then last name.
     *
     * @param search free text, null or blank for no filter
     */
    PageResult<StudentRecord> searchActive(TenantConnection connection, String search, Paging paging);
}
