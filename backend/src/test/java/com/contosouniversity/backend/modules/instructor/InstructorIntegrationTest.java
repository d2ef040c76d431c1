package com.contosouniversity.backend.modules.instructor;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.contosouniversity.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class InstructorIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void indexViewListsInstructorsByName() throws Exception {
        mockMvc.perform(get("/instructors/view"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.instructors", hasSize(10)))
                .andExpect(jsonPath("$.instructors[0].lastName").value("Abercrombie"))
                .andExpect(jsonPath("$.courses").doesNotExist())
                .andExpect(jsonPath("$.enrollments").doesNotExist());
    }

    @Test
    void indexViewDrillsDownToEnrollments() throws Exception {
        mockMvc.perform(get("/instructors/view").param("id", "3").param("courseID", "1050"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.selectedCourseId").value(1050))
                .andExpect(jsonPath("$.courses[*].courseId", contains(1050, 3141)))
                .andExpect(jsonPath("$.enrollments", hasSize(5)))
                .andExpect(jsonPath("$.enrollments[*].courseId", everyItem(is(1050))))
                .andExpect(jsonPath("$.diagnostics", hasSize(0)));
    }

    @Test
    void indexViewReportsCourseNotTaught() throws Exception {
        mockMvc.perform(get("/instructors/view").param("id", "3").param("courseID", "2021"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enrollments", hasSize(0)))
                .andExpect(jsonPath("$.diagnostics[0]").value("COURSE_NOT_ASSIGNED"));
    }

    @Test
    void replaceCoursesAppliesDifferencesAndWarnsOnUnknownIds() throws Exception {
        mockMvc.perform(put("/instructors/6/courses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"courseIds\":[1045,99999]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.added[0]").value(1045))
                .andExpect(jsonPath("$.warnings[0]").value(99999));

        mockMvc.perform(get("/instructors/6/assigned-courses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.courseId == 1045)].assigned").value(true))
                .andExpect(jsonPath("$[?(@.courseId == 1050)].assigned").value(false));
    }

    @Test
    void updateWithoutCourseIdsKeepsLinks() throws Exception {
        mockMvc.perform(put("/instructors/3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"officeLocation\":\"\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.instructor.officeLocation").doesNotExist())
                .andExpect(jsonPath("$.instructor.courses", hasSize(2)))
                .andExpect(jsonPath("$.courseAssignmentChanges").doesNotExist());
    }

    @Test
    void createInstructorWithCourses() throws Exception {
        mockMvc.perform(post("/instructors")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"lastName":"Nguyen","firstMidName":"Anh","hireDate":"2020-09-01",
                                 "officeLocation":"Gowan 12","courseIds":[4022]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.instructor.fullName").value("Nguyen, Anh"))
                .andExpect(jsonPath("$.instructor.courses[0].courseId").value(4022))
                .andExpect(jsonPath("$.courseAssignmentChanges.added[0]").value(4022));
    }

    @Test
    void deleteRejectsDepartmentAdministrator() throws Exception {
        mockMvc.perform(delete("/instructors/1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("instructor.department_administrator"));
    }

    @Test
    void deleteRemovesInstructor() throws Exception {
        mockMvc.perform(delete("/instructors/6"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/instructors/6"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("instructor.not_found"));
    }
}
